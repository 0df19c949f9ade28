package org.opennext.okh.ontology2wikibase.wikibase;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;

import org.apache.http.Consts;
import org.apache.http.NameValuePair;
import org.apache.http.client.CookieStore;
import org.apache.http.client.fluent.Executor;
import org.apache.http.client.fluent.Form;
import org.apache.http.client.fluent.Request;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.impl.client.BasicCookieStore;
import org.json.simple.JSONObject;
import org.json.simple.parser.ParseException;
import org.opennext.okh.ontology2wikibase.mapping.EntityKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A session of HTTP communication with a Wikibase instance, through its {@code api.php}.
 * See:
 * <ul>
 * <li><a href="https://www.mediawiki.org/wiki/API:Login#Method_2._clientlogin">client login</a>;</li>
 * <li><a href="https://www.wikidata.org/w/api.php?action=help&amp;modules=wbeditentity">wbeditentity</a>.</li>
 * </ul>
 * The session cookies live in the client, so one instance is one logged in user.
 *
 * @since 0.1.0
 */
public class ApiWikibaseClient implements WikibaseClient {

    /**
     * MediaWiki wants a return URL for client logins, although it is never used by API clients.
     */
    private static final String LOGIN_RETURN_URL = "http://127.0.0.1:5000/";
    private static final String FORMAT = "json";
    private static final Logger log = LoggerFactory.getLogger(ApiWikibaseClient.class);

    private final URI apiUrl;
    private final CookieStore cookies = new BasicCookieStore();
    private final Executor executor;

    public ApiWikibaseClient(String apiUrl) {
        try {
            this.apiUrl = new URI(apiUrl);
        } catch (URISyntaxException use) {
            throw new IllegalArgumentException("Invalid Wikibase API URL: <" + use.getInput() + ">. Parse error at index " + use.getIndex(), use);
        }
        this.executor = Executor.newInstance().use(cookies);
    }

    @Override
    public void login(String user, String password) throws WikibaseException {
        String loginToken = fetchToken("login", "logintoken");
        JSONObject answer = post("logging in as " + user, Form.form()
            .add("action", "clientlogin")
            .add("username", user)
            .add("password", password)
            .add("loginreturnurl", LOGIN_RETURN_URL)
            .add("logintoken", loginToken)
            .add("format", FORMAT)
            .build());
        String status = WikibaseJson.stringAt(answer, "clientlogin", "status");
        if (!"PASS".equals(status)) {
            String reason = WikibaseJson.stringAt(answer, "clientlogin", "messagecode");
            log.error("Failed to log into Wikibase at <{}> as {}: {}", apiUrl, user, reason);
            throw new AuthenticationException("Failed to log into Wikibase at <" + apiUrl + ">, error: " + reason);
        }
        log.info("Login success! Welcome, {}!", WikibaseJson.stringAt(answer, "clientlogin", "username"));
    }

    @Override
    public String createItem(TargetEntity entity) throws WikibaseException {
        return create(EntityKind.ITEM, entity);
    }

    @Override
    public String createProperty(TargetEntity entity) throws WikibaseException {
        return create(EntityKind.PROPERTY, entity);
    }

    @Override
    public void submitClaims(String entityId, TargetEntity entity) throws WikibaseException {
        String data = WikibaseJson.entityData(entity, false).toJSONString();
        log.debug("Replacing the content of {} with: {}", entityId, data);
        editEntity("editing " + entityId, Form.form()
            .add("action", "wbeditentity")
            .add("id", entityId)
            .add("clear", "true")
            .add("data", data));
    }

    /**
     * A creation rejected because another entity already has the same label reuses that entity:
     * it gets cleared and filled with the given content.
     */
    private String create(EntityKind kind, TargetEntity entity) throws WikibaseException {
        String data = WikibaseJson.entityData(entity, true).toJSONString();
        log.debug("Creating {}: {}", kind.apiName(), data);
        try {
            return editEntity("creating " + kind.apiName(), Form.form()
                .add("action", "wbeditentity")
                .add("new", kind.apiName())
                .add("data", data));
        } catch (RemoteFaultException rfe) {
            String existing = WikibaseJson.conflictingEntity(rfe.getInfo(), kind);
            if (existing == null) throw rfe;
            log.warn("{} {} already has the same label, will clear and reuse it", kind.apiName(), existing);
            submitClaims(existing, entity);
            return existing;
        }
    }

    private String editEntity(String action, Form form) throws WikibaseException {
        form.add("token", fetchCsrfToken()).add("format", FORMAT);
        JSONObject answer = post(action, form.build());
        String id = WikibaseJson.stringAt(answer, "entity", "id");
        if (id == null) throw new RemoteFaultException(action, "no-entity", "The answer carries no entity identifier: " + answer);
        log.debug("Done {}: {}", action, id);
        return id;
    }

    private String fetchCsrfToken() throws WikibaseException {
        return fetchToken(null, "csrftoken");
    }

    /**
     * Fetch a token via the {@code tokens} module.
     *
     * @param type the token type, <code>null</code> for the standard CSRF token.
     */
    private String fetchToken(String type, String key) throws WikibaseException {
        URIBuilder builder = new URIBuilder(apiUrl)
            .setParameter("action", "query")
            .setParameter("meta", "tokens")
            .setParameter("format", FORMAT);
        if (type != null) builder.setParameter("type", type);
        String action = "fetching a " + key;
        URI uri;
        try {
            uri = builder.build();
        } catch (URISyntaxException use) {
            throw new IllegalStateException("Failed building the token request URI from <" + apiUrl + ">", use);
        }
        JSONObject answer = handle(action, () -> executor.execute(Request.Get(uri)).returnContent().asString(Consts.UTF_8));
        String token = WikibaseJson.stringAt(answer, "query", "tokens", key);
        if (token == null) throw new RemoteFaultException(action, "no-token", "The answer carries no token: " + answer);
        return token;
    }

    private JSONObject post(String action, List<NameValuePair> form) throws WikibaseException {
        return handle(action, () -> executor.execute(Request.Post(apiUrl).bodyForm(form, Consts.UTF_8)).returnContent().asString(Consts.UTF_8));
    }

    private JSONObject handle(String action, ApiCall call) throws WikibaseException {
        String raw;
        try {
            raw = call.execute();
        } catch (IOException ioe) {
            log.error("An I/O error occurred while " + action + " at <" + apiUrl + ">", ioe);
            throw new NetworkException("Failed " + action + " at <" + apiUrl + ">", ioe);
        }
        log.debug("Answer to {}: {}", action, raw);
        JSONObject answer;
        try {
            answer = WikibaseJson.parse(raw);
        } catch (ParseException pe) {
            log.error("Malformed JSON answer while {}. Parse error at index {}", action, pe.getPosition());
            throw new RemoteFaultException(action, "malformed-answer", raw);
        }
        if (answer.containsKey("error")) {
            throw new RemoteFaultException(action, WikibaseJson.stringAt(answer, "error", "code"), WikibaseJson.stringAt(answer, "error", "info"));
        }
        return answer;
    }

    /**
     * Closes this session. The cookies are dropped, further calls need a new login.
     */
    @Override
    public void close() {
        cookies.clear();
    }

    @FunctionalInterface
    private interface ApiCall {
        String execute() throws IOException;
    }
}
