package org.springaicommunity.crm.extractor;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Drives a {@link PageFetcher} across a cursor-paginated collection and hands the
 * normalized records to the caller as a lazy, single-pass {@link ExtractionRun}.
 *
 * <p>
 * The paginator itself is stateless and may start any number of runs; each run owns its
 * cursor, counters and checkpoints. Runs never read checkpoint storage: resuming is done
 * by passing a {@link ResumePoint} built from the last persisted checkpoint.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * CheckpointedPaginator<DealRecord> paginator = new CheckpointedPaginator<>(fetcher,
 *     new DealRecordTransformer(), "hubspot_deals");
 * ExtractionRun<DealRecord> run = paginator.extract(job, filters, resumeFrom,
 *     repository::save, cancelSignal, pauseSignal);
 * run.forEachRemaining(sink::upsert);
 * }
 * </pre>
 *
 * @param <T> normalized record type
 */
public class CheckpointedPaginator<T> {

	private static final Logger logger = LoggerFactory.getLogger(CheckpointedPaginator.class);

	private final PageFetcher fetcher;

	private final RecordTransformer<T> transformer;

	private final String sourceService;

	private final Clock clock;

	public CheckpointedPaginator(PageFetcher fetcher, RecordTransformer<T> transformer, String sourceService) {
		this(fetcher, transformer, sourceService, Clock.systemUTC());
	}

	public CheckpointedPaginator(PageFetcher fetcher, RecordTransformer<T> transformer, String sourceService,
			Clock clock) {
		this.fetcher = fetcher;
		this.transformer = transformer;
		this.sourceService = sourceService;
		this.clock = clock;
	}

	/**
	 * Start a run without checkpoints or control signals.
	 * @param job job identity
	 * @param filters filter and pacing parameters
	 * @return the lazy run; nothing is fetched until it is iterated
	 */
	public ExtractionRun<T> extract(JobConfig job, ExtractionFilters filters) {
		return extract(job, filters, null, CheckpointCallback.noop(), ControlSignal.never(), ControlSignal.never());
	}

	/**
	 * Start a run.
	 * @param job job identity; its scan id keys checkpoints and control signals
	 * @param filters filter and pacing parameters
	 * @param resumeFrom where to continue from, or null to start at the beginning
	 * @param checkpointCallback receives every checkpoint; failures are logged and ignored
	 * @param cancel polled once per page
	 * @param pause polled once per page and once per record
	 * @return the lazy run; nothing is fetched until it is iterated
	 */
	public ExtractionRun<T> extract(JobConfig job, ExtractionFilters filters, @Nullable ResumePoint resumeFrom,
			CheckpointCallback checkpointCallback, ControlSignal cancel, ControlSignal pause) {
		if (resumeFrom != null) {
			logger.info("Resuming {} extraction {} at page {} ({} records already processed, cursor {})",
					sourceService, job.scanId(), resumeFrom.pageNumber() + 1, resumeFrom.recordsProcessed(),
					abbreviate(resumeFrom.cursor()));
		}
		else {
			logger.info("Starting fresh {} extraction {}", sourceService, job.scanId());
		}
		return new ExtractionRun<>(fetcher, transformer, sourceService, clock, job, filters, resumeFrom,
				checkpointCallback, cancel, pause);
	}

	@Nullable
	static String abbreviate(@Nullable String cursor) {
		if (cursor == null || cursor.length() <= 50) {
			return cursor;
		}
		return cursor.substring(0, 50) + "...";
	}

}
