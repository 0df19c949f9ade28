/**
 * The Wikibase side: entity definitions, their JSON serialization and the clients of the
 * <a href="https://www.mediawiki.org/wiki/Wikibase/API">Wikibase API</a>.
 *
 * @since 0.1.0
 */
package org.opennext.okh.ontology2wikibase.wikibase;
