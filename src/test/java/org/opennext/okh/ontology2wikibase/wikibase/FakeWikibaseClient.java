package org.opennext.okh.ontology2wikibase.wikibase;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An in-memory Wikibase, keeping every created entity and the last content submitted for it.
 * Identifiers start at {@code Q100} and {@code P100}, away from the ones used by fixtures.
 */
public class FakeWikibaseClient implements WikibaseClient {

    private final Map<String, TargetEntity> entities = new LinkedHashMap<>();
    private final List<String> created = new ArrayList<>();
    private final List<String> submissions = new ArrayList<>();
    private int nextItem = 100;
    private int nextProperty = 100;
    private String failingLabel;

    @Override
    public void login(String user, String password) {
    }

    @Override
    public String createItem(TargetEntity entity) {
        return store("Q" + nextItem++, entity);
    }

    @Override
    public String createProperty(TargetEntity entity) {
        return store("P" + nextProperty++, entity);
    }

    private String store(String id, TargetEntity entity) {
        entities.put(id, entity);
        created.add(id);
        return id;
    }

    @Override
    public void submitClaims(String entityId, TargetEntity entity) throws WikibaseException {
        if (failingLabel != null && failingLabel.equals(entity.getLabels().get("en"))) {
            throw new RemoteFaultException("editing " + entityId, "failed-save", "Simulated failure");
        }
        entities.put(entityId, entity);
        submissions.add(entityId);
    }

    /**
     * Make {@link #submitClaims(String, TargetEntity)} fail for entities with the given English label.
     */
    public void failOn(String label) {
        this.failingLabel = label;
    }

    public TargetEntity entity(String id) {
        return entities.get(id);
    }

    /**
     * Identifiers of the created entities, in creation order.
     */
    public List<String> created() {
        return created;
    }

    public List<String> submissions() {
        return submissions;
    }

    @Override
    public void close() {
    }
}
