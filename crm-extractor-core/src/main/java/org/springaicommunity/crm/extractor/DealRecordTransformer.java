package org.springaicommunity.crm.extractor;

import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Maps raw deal objects to {@link DealRecord}s.
 *
 * <p>
 * Numeric and timestamp fields are parsed leniently: anything that cannot be parsed
 * becomes null instead of failing the record.
 */
public class DealRecordTransformer implements RecordTransformer<DealRecord> {

	static final String DEFAULT_CURRENCY = "USD";

	static final String DEAL_URL_FORMAT = "https://app.hubspot.com/contacts/%s/deal/%s";

	private static final double MILLIS_THRESHOLD = 1e10;

	@Override
	public DealRecord transform(RawRecord record, ExtractionMetadata metadata) {
		String currency = record.stringProperty("deal_currency_code");
		String dealUrl = record.id() != null && !record.id().isEmpty()
				? String.format(DEAL_URL_FORMAT, orEmpty(record.stringProperty("hs_object_id")), record.id()) : null;

		return new DealRecord(record.id(), record.stringProperty("dealname"), safeDecimal(record.property("amount")),
				currency != null ? currency : DEFAULT_CURRENCY, record.stringProperty("dealstage"),
				record.stringProperty("dealstage_label"), record.stringProperty("pipeline"),
				record.stringProperty("pipeline_label"), safeTimestamp(record.property("closedate")),
				safeTimestamp(record.property("createdate")), safeTimestamp(record.property("hs_lastmodifieddate")),
				record.stringProperty("hubspot_owner_id"), record.stringProperty("hubspot_owner_email"),
				record.stringProperty("dealtype"), record.archived(), dealUrl, record.properties(),
				record.associations(), metadata);
	}

	/**
	 * Parse a decimal from a number or numeric string.
	 * @param value raw value
	 * @return the decimal, or null if absent or unparseable
	 */
	@Nullable
	public static BigDecimal safeDecimal(@Nullable Object value) {
		if (value instanceof BigDecimal decimal) {
			return decimal;
		}
		if (value instanceof Number || value instanceof String) {
			try {
				return new BigDecimal(value.toString().trim());
			}
			catch (NumberFormatException e) {
				return null;
			}
		}
		return null;
	}

	/**
	 * Parse a timestamp from epoch milliseconds (digit strings), epoch seconds or
	 * milliseconds (numbers, millis when above 1e10), or an ISO-8601 string with or
	 * without offset (UTC assumed when absent).
	 * @param value raw value
	 * @return the instant, or null if absent, zero, empty or unparseable
	 */
	@Nullable
	public static Instant safeTimestamp(@Nullable Object value) {
		try {
			if (value instanceof Number number) {
				double numeric = number.doubleValue();
				if (numeric == 0 || Double.isNaN(numeric) || Double.isInfinite(numeric)) {
					return null;
				}
				long millis = numeric > MILLIS_THRESHOLD ? number.longValue() : Math.round(numeric * 1000);
				return Instant.ofEpochMilli(millis);
			}
			if (value instanceof String text) {
				String trimmed = text.trim();
				if (trimmed.isEmpty()) {
					return null;
				}
				if (trimmed.chars().allMatch(Character::isDigit)) {
					return Instant.ofEpochMilli(Long.parseLong(trimmed));
				}
				return parseIso(trimmed);
			}
		}
		catch (NumberFormatException | DateTimeException | ArithmeticException e) {
			return null;
		}
		return null;
	}

	@Nullable
	private static Instant parseIso(String text) {
		try {
			return OffsetDateTime.parse(text).toInstant();
		}
		catch (DateTimeParseException e) {
			// fall through to local forms
		}
		try {
			return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
		}
		catch (DateTimeParseException e) {
			// fall through to date-only
		}
		try {
			return LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC);
		}
		catch (DateTimeParseException e) {
			return null;
		}
	}

	private static String orEmpty(@Nullable String value) {
		return value != null ? value : "";
	}

}
