package org.springaicommunity.crm.extractor;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * One extraction run: a lazy, single-pass iterator over normalized records.
 *
 * <p>
 * Pages are fetched on demand while the caller pulls records. Before each page the cancel
 * and pause signals are polled; before each record the pause signal is polled again, so a
 * pause takes effect between two records of the same page. Every early stop, the natural
 * end and a failed fetch are recorded as a checkpoint through the
 * {@link CheckpointCallback}. The run cannot be restarted; start a new run with a
 * {@link ResumePoint} instead.
 *
 * <p>
 * Not thread-safe. A run is consumed by one thread at a time.
 *
 * @param <T> normalized record type
 */
public final class ExtractionRun<T> implements Iterator<T> {

	private static final Logger logger = LoggerFactory.getLogger(ExtractionRun.class);

	private final PageFetcher fetcher;

	private final RecordTransformer<T> transformer;

	private final String sourceService;

	private final Clock clock;

	private final JobConfig job;

	private final ExtractionFilters filters;

	private final CheckpointCallback checkpointCallback;

	private final ControlSignal cancel;

	private final ControlSignal pause;

	private RunState state = RunState.STARTING;

	@Nullable
	private String cursor;

	private int pageNumber;

	private long completedRecords;

	@Nullable
	private PageResult currentPage;

	private int pageIndex;

	private int pageRecords;

	@Nullable
	private T pending;

	private boolean limitReached;

	private boolean streamed;

	private int checkpointFailures;

	@Nullable
	private CheckpointState lastCheckpoint;

	ExtractionRun(PageFetcher fetcher, RecordTransformer<T> transformer, String sourceService, Clock clock,
			JobConfig job, ExtractionFilters filters, @Nullable ResumePoint resumeFrom,
			CheckpointCallback checkpointCallback, ControlSignal cancel, ControlSignal pause) {
		this.fetcher = fetcher;
		this.transformer = transformer;
		this.sourceService = sourceService;
		this.clock = clock;
		this.job = job;
		this.filters = filters;
		this.checkpointCallback = checkpointCallback;
		this.cancel = cancel;
		this.pause = pause;
		if (resumeFrom != null) {
			this.cursor = resumeFrom.cursor();
			this.pageNumber = resumeFrom.pageNumber();
			this.completedRecords = resumeFrom.recordsProcessed();
		}
	}

	@Override
	public boolean hasNext() {
		if (pending != null) {
			return true;
		}
		while (!state.isTerminal()) {
			PageResult page = currentPage;
			if (page == null) {
				fetchNextPage();
				continue;
			}
			if (pageIndex < page.records().size()) {
				if (pause.isRequested(job.scanId())) {
					pauseMidPage();
					return false;
				}
				RawRecord record = page.records().get(pageIndex++);
				pending = transform(record);
				state = RunState.YIELDING;
				return true;
			}
			completePage(page);
		}
		return false;
	}

	@Override
	public T next() {
		if (!hasNext()) {
			throw new NoSuchElementException("Extraction run " + job.scanId() + " has ended in state " + state);
		}
		T record = pending;
		pending = null;
		pageRecords++;
		return record;
	}

	/**
	 * Expose the remaining records as a sequential stream. May be called once.
	 * @return stream over the records not yet consumed
	 * @throws IllegalStateException if a stream was already requested
	 */
	public Stream<T> stream() {
		if (streamed) {
			throw new IllegalStateException("Extraction run " + job.scanId() + " can only be streamed once");
		}
		streamed = true;
		return StreamSupport.stream(
				Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false);
	}

	public String runId() {
		return job.scanId();
	}

	public RunState state() {
		return state;
	}

	/**
	 * Number of pages fully consumed, including pages of the runs this one resumed.
	 */
	public int pageNumber() {
		return pageNumber;
	}

	/**
	 * Records delivered so far, including those already delivered from the current page.
	 */
	public long recordsProcessed() {
		return completedRecords + pageRecords;
	}

	/**
	 * Returns true if the run stopped because the page limit was reached while more pages
	 * were available.
	 */
	public boolean isLimitReached() {
		return limitReached;
	}

	/**
	 * Number of checkpoints the callback failed to persist.
	 */
	public int checkpointFailures() {
		return checkpointFailures;
	}

	public Optional<CheckpointState> lastCheckpoint() {
		return Optional.ofNullable(lastCheckpoint);
	}

	private void fetchNextPage() {
		if (pageNumber >= filters.maxPages()) {
			limitReached = true;
			logger.warn("Extraction {} reached the limit of {} pages with more data pending", job.scanId(),
					filters.maxPages());
			Map<String, @Nullable Object> details = new LinkedHashMap<>();
			details.put("pages_processed", pageNumber);
			details.put("stop_reason", "max_pages_reached");
			persist(CheckpointPhase.IN_PROGRESS, cursor, completedRecords, details);
			state = RunState.COMPLETED;
			return;
		}

		if (cancel.isRequested(job.scanId())) {
			logger.info("Extraction {} cancelled by user at page {} ({} records processed)", job.scanId(),
					pageNumber + 1, completedRecords);
			Map<String, @Nullable Object> details = new LinkedHashMap<>();
			details.put("cancellation_reason", "user_requested");
			details.put("cancelled_at_page", pageNumber);
			persist(CheckpointPhase.CANCELLED, cursor, completedRecords, details);
			state = RunState.CANCELLED;
			return;
		}

		if (pause.isRequested(job.scanId())) {
			logger.info("Extraction {} paused by user at page {} ({} records processed)", job.scanId(),
					pageNumber + 1, completedRecords);
			Map<String, @Nullable Object> details = new LinkedHashMap<>();
			details.put("pause_reason", "user_requested");
			details.put("paused_at_page", pageNumber);
			details.put("paused_at", clock.instant().toString());
			persist(CheckpointPhase.PAUSED, cursor, completedRecords, details);
			state = RunState.PAUSED;
			return;
		}

		state = RunState.FETCHING;
		logger.debug("Fetching page {} of extraction {} (batch size {})", pageNumber + 1, job.scanId(),
				filters.effectiveBatchSize());
		PageResult page;
		try {
			page = fetcher.fetch(filters.toPageRequest(cursor));
		}
		catch (RuntimeException e) {
			fail(e);
			throw e;
		}

		if (page.isEmpty()) {
			logger.info("No more records to process for extraction {} at page {}", job.scanId(), pageNumber + 1);
			Map<String, @Nullable Object> details = new LinkedHashMap<>();
			details.put("completion_status", "no_more_records");
			details.put("total_pages", pageNumber);
			details.put("final_total", completedRecords);
			persist(CheckpointPhase.COMPLETED, null, completedRecords, details);
			state = RunState.COMPLETED;
			return;
		}

		currentPage = page;
		pageIndex = 0;
		pageRecords = 0;
	}

	private T transform(RawRecord record) {
		ExtractionMetadata metadata = new ExtractionMetadata(clock.instant(), job.scanId(), job.organizationId(),
				pageNumber + 1, sourceService);
		try {
			return transformer.transform(record, metadata);
		}
		catch (RuntimeException e) {
			fail(e);
			throw e;
		}
	}

	private void pauseMidPage() {
		logger.info("Extraction {} paused mid-page at page {} after {} records of the page ({} total)", job.scanId(),
				pageNumber + 1, pageRecords, recordsProcessed());
		Map<String, @Nullable Object> details = new LinkedHashMap<>();
		details.put("pause_reason", "user_requested_mid_page");
		details.put("records_completed_in_page", pageRecords);
		details.put("paused_at", clock.instant().toString());
		persist(CheckpointPhase.PAUSED_MID_PAGE, cursor, recordsProcessed(), details);
		state = RunState.PAUSED;
	}

	private void completePage(PageResult page) {
		int recordsInPage = pageRecords;
		completedRecords += recordsInPage;
		pageRecords = 0;
		pageNumber++;
		currentPage = null;
		logger.info("Processed page {} of extraction {}: {} records ({} total)", pageNumber, job.scanId(),
				recordsInPage, completedRecords);

		if (pageNumber % filters.checkpointInterval() == 0) {
			state = RunState.CHECKPOINTING;
			Map<String, @Nullable Object> details = new LinkedHashMap<>();
			details.put("pages_processed", pageNumber);
			details.put("last_page_records", recordsInPage);
			persist(CheckpointPhase.IN_PROGRESS, page.nextCursor(), completedRecords, details);
		}

		if (page.hasNext()) {
			cursor = page.nextCursor();
			state = RunState.FETCHING;
			return;
		}

		cursor = null;
		Map<String, @Nullable Object> details = new LinkedHashMap<>();
		details.put("completion_status", "success");
		details.put("total_pages", pageNumber);
		details.put("final_total", completedRecords);
		persist(CheckpointPhase.COMPLETED, null, completedRecords, details);
		state = RunState.COMPLETED;
		logger.info("Extraction {} completed successfully: {} records in {} pages", job.scanId(), completedRecords,
				pageNumber);
	}

	private void fail(RuntimeException e) {
		logger.error("Error processing page {} of extraction {}: {}", pageNumber + 1, job.scanId(), e.getMessage(),
				e);
		Map<String, @Nullable Object> details = new LinkedHashMap<>();
		details.put("error", String.valueOf(e.getMessage()));
		details.put("error_page", pageNumber + 1);
		details.put("recovery_cursor", cursor);
		persist(CheckpointPhase.ERROR, cursor, completedRecords, details);
		currentPage = null;
		pending = null;
		pageRecords = 0;
		state = RunState.ERRORED;
	}

	private void persist(CheckpointPhase phase, @Nullable String checkpointCursor, long records,
			Map<String, @Nullable Object> details) {
		Map<String, @Nullable Object> extra = new LinkedHashMap<>();
		extra.put("service", sourceService);
		extra.put("timestamp", clock.instant().toString());
		extra.putAll(details);
		CheckpointState checkpoint = new CheckpointState(phase, records, checkpointCursor, pageNumber,
				filters.effectiveBatchSize(), extra);
		lastCheckpoint = checkpoint;
		try {
			checkpointCallback.save(job.scanId(), checkpoint);
			logger.debug("Saved {} checkpoint for extraction {} at page {} ({} records)", phase.wireName(),
					job.scanId(), pageNumber, records);
		}
		catch (Exception e) {
			if (e instanceof InterruptedException) {
				Thread.currentThread().interrupt();
			}
			checkpointFailures++;
			logger.warn("Failed to save {} checkpoint for extraction {}: {}", phase.wireName(), job.scanId(),
					e.toString());
		}
	}

}
