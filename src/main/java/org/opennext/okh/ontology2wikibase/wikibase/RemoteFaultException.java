package org.opennext.okh.ontology2wikibase.wikibase;

import java.util.Locale;

/**
 * The Wikibase API answered with an error.
 *
 * @since 0.1.0
 */
public class RemoteFaultException extends WikibaseException {

    private final String code;
    private final String info;

    public RemoteFaultException(String action, String code, String info) {
        super(String.format(Locale.ENGLISH, "Failed %s, reason: %s - %s", action, code, info));
        this.code = code;
        this.info = info;
    }

    /**
     * The API error code, e.g., {@code modification-failed}.
     */
    public String getCode() {
        return code;
    }

    public String getInfo() {
        return info;
    }
}
