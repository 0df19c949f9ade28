package org.opennext.okh.ontology2wikibase.conversion;

import java.time.Instant;
import java.util.Locale;

import org.openrdf.model.URI;

import com.google.common.base.Preconditions;

/**
 * An ontology URI and the Wikibase entity it corresponds to.
 *
 * @since 0.1.0
 */
public final class CorrespondenceRecord {

    private final URI source;
    private final String targetId;
    private final Instant created;

    CorrespondenceRecord(URI source, String targetId, Instant created) {
        this.source = Preconditions.checkNotNull(source);
        this.targetId = Preconditions.checkNotNull(targetId);
        this.created = created;
    }

    public URI getSource() {
        return source;
    }

    public String getTargetId() {
        return targetId;
    }

    /**
     * @return when the record was made, <code>null</code> for records of links files lacking it.
     */
    public Instant getCreated() {
        return created;
    }

    @Override
    public String toString() {
        return String.format(Locale.ENGLISH, "<%s> = %s", source, targetId);
    }
}
