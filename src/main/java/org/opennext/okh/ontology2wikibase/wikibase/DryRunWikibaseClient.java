package org.opennext.okh.ontology2wikibase.wikibase;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pretend to talk to a Wikibase: every call is logged and nothing leaves the machine.
 * Created entities get sequential identifiers, starting from {@code Q1} and {@code P1}.
 *
 * @since 0.1.0
 */
public class DryRunWikibaseClient implements WikibaseClient {

    private static final Logger log = LoggerFactory.getLogger(DryRunWikibaseClient.class);

    private int lastItem;
    private int lastProperty;

    @Override
    public void login(String user, String password) {
        log.info("Dry run: would log in as {}", user);
    }

    @Override
    public String createItem(TargetEntity entity) {
        String id = "Q" + ++lastItem;
        log.info("Dry run: would create item {} as {}", entity.getLabels(), id);
        log.debug("Dry run: item data {}", WikibaseJson.entityData(entity, true).toJSONString());
        return id;
    }

    @Override
    public String createProperty(TargetEntity entity) {
        String id = "P" + ++lastProperty;
        log.info("Dry run: would create {} property {} as {}", entity.getDatatype().id(), entity.getLabels(), id);
        log.debug("Dry run: property data {}", WikibaseJson.entityData(entity, true).toJSONString());
        return id;
    }

    @Override
    public void submitClaims(String entityId, TargetEntity entity) {
        log.info("Dry run: would replace the content of {} with {} claims", entityId, entity.getClaims().size());
        log.debug("Dry run: {} data {}", entityId, WikibaseJson.entityData(entity, false).toJSONString());
    }

    @Override
    public void close() {
        log.debug("Dry run: {} items and {} properties would have been created", lastItem, lastProperty);
    }
}
