/**
 * The conversion engine: correspondences between ontology URIs and Wikibase identifiers, entity resolution and building,
 * and the two-phase run over the whole ontology.
 * See {@link org.opennext.okh.ontology2wikibase.conversion.ConversionOrchestrator} for the entry point.
 *
 * @since 0.1.0
 */
package org.opennext.okh.ontology2wikibase.conversion;
