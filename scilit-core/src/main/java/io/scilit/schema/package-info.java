/**
 * Read-only schema introspection and validation against the expected catalog.
 *
 * @see io.scilit.schema.SchemaValidator
 * @see io.scilit.schema.ExpectedSchema#SCIENTIFIC_LITERATURE
 */
package io.scilit.schema;
