package org.springaicommunity.crm.extractor;

/**
 * Maps one raw record to the normalized output schema.
 *
 * <p>
 * Implementations must be pure and must not throw on malformed field values; such fields
 * become null.
 *
 * @param <T> normalized record type
 */
@FunctionalInterface
public interface RecordTransformer<T> {

	T transform(RawRecord record, ExtractionMetadata metadata);

}
