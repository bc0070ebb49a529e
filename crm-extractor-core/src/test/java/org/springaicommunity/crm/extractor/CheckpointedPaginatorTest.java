package org.springaicommunity.crm.extractor;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link CheckpointedPaginator} and the {@link ExtractionRun}s it starts.
 *
 * Drives runs against an in-memory page fetcher keyed by cursor and records every
 * checkpoint handed to the callback.
 */
@DisplayName("CheckpointedPaginator Tests")
class CheckpointedPaginatorTest {

	private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

	private static final JobConfig JOB = JobConfig.of("scan-1", "org-1");

	private final FakeFetcher fetcher = new FakeFetcher();

	private final List<CheckpointState> checkpoints = new ArrayList<>();

	private final List<ExtractionMetadata> metadata = new ArrayList<>();

	private final CheckpointCallback recorder = (runId, state) -> {
		assertThat(runId).isEqualTo("scan-1");
		checkpoints.add(state);
	};

	private CheckpointedPaginator<String> paginator;

	@BeforeEach
	void setUp() {
		RecordTransformer<String> transformer = (record, meta) -> {
			metadata.add(meta);
			return record.id();
		};
		paginator = new CheckpointedPaginator<>(fetcher, transformer, "hubspot_deals",
				Clock.fixed(NOW, ZoneOffset.UTC));
	}

	private static RawRecord raw(String id) {
		return new RawRecord(id, Map.of("dealname", "Deal " + id), Map.of(), null, null, false);
	}

	private static PageResult page(String nextCursor, String... ids) {
		List<RawRecord> records = new ArrayList<>();
		for (String id : ids) {
			records.add(raw(id));
		}
		return new PageResult(records, nextCursor, null);
	}

	/**
	 * Three pages holding 2, 2 and 1 records.
	 */
	private void threePages() {
		fetcher.page(null, page("p1", "1", "2"));
		fetcher.page("p1", page("p2", "3", "4"));
		fetcher.page("p2", page(null, "5"));
	}

	private static List<String> drain(ExtractionRun<String> run) {
		List<String> out = new ArrayList<>();
		while (run.hasNext()) {
			out.add(run.next());
		}
		return out;
	}

	private ExtractionFilters filters(int batchSize) {
		return ExtractionFilters.defaults().withBatchSize(batchSize);
	}

	private ExtractionRun<String> start(ExtractionFilters filters) {
		return paginator.extract(JOB, filters, null, recorder, ControlSignal.never(), ControlSignal.never());
	}

	@Nested
	@DisplayName("Pagination Tests")
	class PaginationTest {

		@Test
		@DisplayName("Should follow cursors until the last page and write a completed checkpoint")
		void shouldExtractAllPages() {
			threePages();
			ExtractionRun<String> run = start(filters(2));

			List<String> records = drain(run);

			assertThat(records).containsExactly("1", "2", "3", "4", "5");
			assertThat(fetcher.cursors()).containsExactly(null, "p1", "p2");
			assertThat(fetcher.requests).allSatisfy(request -> assertThat(request.batchSize()).isEqualTo(2));
			assertThat(run.state()).isEqualTo(RunState.COMPLETED);
			assertThat(run.recordsProcessed()).isEqualTo(5);
			assertThat(run.pageNumber()).isEqualTo(3);
			assertThat(run.isLimitReached()).isFalse();

			assertThat(checkpoints).hasSize(1);
			CheckpointState completed = checkpoints.get(0);
			assertThat(completed.phase()).isEqualTo(CheckpointPhase.COMPLETED);
			assertThat(completed.recordsProcessed()).isEqualTo(5);
			assertThat(completed.cursor()).isNull();
			assertThat(completed.pageNumber()).isEqualTo(3);
			assertThat(completed.batchSize()).isEqualTo(2);
			assertThat(completed.extra()).containsEntry("service", "hubspot_deals")
				.containsEntry("timestamp", NOW.toString())
				.containsEntry("completion_status", "success")
				.containsEntry("total_pages", 3)
				.containsEntry("final_total", 5L);
			assertThat(run.lastCheckpoint()).contains(completed);
		}

		@Test
		@DisplayName("Should complete with no records when the first page is empty")
		void shouldCompleteOnEmptyFirstPage() {
			fetcher.page(null, page(null));
			ExtractionRun<String> run = start(filters(100));

			assertThat(drain(run)).isEmpty();
			assertThat(run.state()).isEqualTo(RunState.COMPLETED);
			assertThat(checkpoints).singleElement().satisfies(checkpoint -> {
				assertThat(checkpoint.phase()).isEqualTo(CheckpointPhase.COMPLETED);
				assertThat(checkpoint.recordsProcessed()).isZero();
				assertThat(checkpoint.extra()).containsEntry("completion_status", "no_more_records");
			});
		}

		@Test
		@DisplayName("Should write in_progress checkpoints at the interval carrying the next cursor")
		void shouldCheckpointAtInterval() {
			threePages();
			ExtractionRun<String> run = start(filters(2).withCheckpointInterval(2));

			drain(run);

			assertThat(checkpoints).extracting(CheckpointState::phase)
				.containsExactly(CheckpointPhase.IN_PROGRESS, CheckpointPhase.COMPLETED);
			CheckpointState interval = checkpoints.get(0);
			assertThat(interval.cursor()).isEqualTo("p2");
			assertThat(interval.pageNumber()).isEqualTo(2);
			assertThat(interval.recordsProcessed()).isEqualTo(4);
			assertThat(interval.extra()).containsEntry("pages_processed", 2).containsEntry("last_page_records", 2);
		}

		@Test
		@DisplayName("Should stamp every record with provenance metadata")
		void shouldStampMetadata() {
			threePages();

			drain(start(filters(2)));

			assertThat(metadata).extracting(ExtractionMetadata::pageNumber).containsExactly(1, 1, 2, 2, 3);
			assertThat(metadata).allSatisfy(meta -> {
				assertThat(meta.scanId()).isEqualTo("scan-1");
				assertThat(meta.organizationId()).isEqualTo("org-1");
				assertThat(meta.sourceService()).isEqualTo("hubspot_deals");
				assertThat(meta.extractedAt()).isEqualTo(NOW);
			});
		}

		@Test
		@DisplayName("Should stop at the page limit with an in_progress checkpoint")
		void shouldStopAtMaxPages() {
			threePages();
			ExtractionRun<String> run = start(filters(2).withMaxPages(2));

			assertThat(drain(run)).containsExactly("1", "2", "3", "4");
			assertThat(run.isLimitReached()).isTrue();
			assertThat(run.state()).isEqualTo(RunState.COMPLETED);
			assertThat(fetcher.cursors()).containsExactly(null, "p1");

			CheckpointState last = checkpoints.get(checkpoints.size() - 1);
			assertThat(last.phase()).isEqualTo(CheckpointPhase.IN_PROGRESS);
			assertThat(last.cursor()).isEqualTo("p2");
			assertThat(last.recordsProcessed()).isEqualTo(4);
			assertThat(last.extra()).containsEntry("stop_reason", "max_pages_reached");
		}

		@Test
		@DisplayName("Should pass filters through to the fetcher")
		void shouldPassFiltersThrough() {
			fetcher.page(null, page(null, "1"));
			ExtractionFilters filters = ExtractionFilters.defaults()
				.withBatchSize(500)
				.withProperties(List.of("dealname"))
				.withAssociations(List.of("contacts"))
				.withIncludeArchived(true)
				.withExtraParams(Map.of("sort", "createdate"));

			drain(start(filters));

			PageRequest request = fetcher.requests.get(0);
			assertThat(request.batchSize()).isEqualTo(100);
			assertThat(request.properties()).containsExactly("dealname");
			assertThat(request.associations()).containsExactly("contacts");
			assertThat(request.includeArchived()).isTrue();
			assertThat(request.extraParams()).containsEntry("sort", "createdate");
		}

	}

	@Nested
	@DisplayName("Resume Tests")
	class ResumeTest {

		@Test
		@DisplayName("Should continue from the resume cursor with carried counters")
		void shouldResumeFromCursor() {
			fetcher.page("abc", page(null, "a", "b"));
			ExtractionRun<String> run = paginator.extract(JOB, filters(100), new ResumePoint("abc", 3, 250), recorder,
					ControlSignal.never(), ControlSignal.never());

			assertThat(drain(run)).containsExactly("a", "b");
			assertThat(fetcher.cursors()).containsExactly("abc");
			assertThat(metadata).extracting(ExtractionMetadata::pageNumber).containsOnly(4);
			assertThat(run.pageNumber()).isEqualTo(4);
			assertThat(run.recordsProcessed()).isEqualTo(252);
			assertThat(checkpoints).singleElement().satisfies(checkpoint -> {
				assertThat(checkpoint.phase()).isEqualTo(CheckpointPhase.COMPLETED);
				assertThat(checkpoint.recordsProcessed()).isEqualTo(252);
				assertThat(checkpoint.pageNumber()).isEqualTo(4);
			});
		}

		@Test
		@DisplayName("Should count resumed pages against the page limit")
		void shouldCountResumedPagesAgainstLimit() {
			ExtractionRun<String> run = paginator.extract(JOB, filters(100).withMaxPages(3),
					new ResumePoint("abc", 3, 250), recorder, ControlSignal.never(), ControlSignal.never());

			assertThat(drain(run)).isEmpty();
			assertThat(run.isLimitReached()).isTrue();
			assertThat(fetcher.requests).isEmpty();
		}

	}

	@Nested
	@DisplayName("Control Signal Tests")
	class ControlSignalTest {

		@Test
		@DisplayName("Should pause between two records of the same page")
		void shouldPauseMidPage() {
			String[] ids = IntStream.rangeClosed(1, 10).mapToObj(String::valueOf).toArray(String[]::new);
			fetcher.page(null, page("p1", ids));
			AtomicBoolean pause = new AtomicBoolean();
			ExtractionRun<String> run = paginator.extract(JOB, filters(10), null, recorder, ControlSignal.never(),
					runId -> pause.get());

			List<String> out = new ArrayList<>();
			while (run.hasNext()) {
				out.add(run.next());
				if (out.size() == 4) {
					pause.set(true);
				}
			}

			assertThat(out).containsExactly("1", "2", "3", "4");
			assertThat(run.state()).isEqualTo(RunState.PAUSED);
			assertThat(run.recordsProcessed()).isEqualTo(4);
			assertThat(checkpoints).singleElement().satisfies(checkpoint -> {
				assertThat(checkpoint.phase()).isEqualTo(CheckpointPhase.PAUSED_MID_PAGE);
				assertThat(checkpoint.recordsProcessed()).isEqualTo(4);
				assertThat(checkpoint.cursor()).isNull();
				assertThat(checkpoint.pageNumber()).isZero();
				assertThat(checkpoint.extra()).containsEntry("records_completed_in_page", 4)
					.containsEntry("paused_at", NOW.toString());
			});
		}

		@Test
		@DisplayName("Should refetch the partially consumed page when resuming a mid-page pause")
		void shouldRefetchPageAfterMidPagePause() {
			fetcher.page(null, page("p1", "1", "2", "3"));
			fetcher.page("p1", page(null, "4"));
			AtomicBoolean pause = new AtomicBoolean();
			ExtractionRun<String> first = paginator.extract(JOB, filters(3), null, recorder, ControlSignal.never(),
					runId -> pause.get());
			first.next();
			pause.set(true);
			assertThat(first.hasNext()).isFalse();

			ResumePoint resumePoint = ResumePoint.from(first.lastCheckpoint().orElseThrow());
			ExtractionRun<String> second = paginator.extract(JOB, filters(3), resumePoint, recorder,
					ControlSignal.never(), ControlSignal.never());

			assertThat(drain(second)).containsExactly("1", "2", "3", "4");
			assertThat(fetcher.cursors()).containsExactly(null, null, "p1");
		}

		@Test
		@DisplayName("Should pause before fetching when requested at a page boundary")
		void shouldPauseAtPageBoundary() {
			threePages();
			AtomicBoolean pause = new AtomicBoolean();
			ExtractionRun<String> run = paginator.extract(JOB, filters(2), null, recorder, ControlSignal.never(),
					runId -> pause.get());

			run.next();
			run.next();
			pause.set(true);

			assertThat(run.hasNext()).isFalse();
			assertThat(fetcher.cursors()).containsExactly((String) null);
			assertThat(checkpoints).singleElement().satisfies(checkpoint -> {
				assertThat(checkpoint.phase()).isEqualTo(CheckpointPhase.PAUSED);
				assertThat(checkpoint.cursor()).isEqualTo("p1");
				assertThat(checkpoint.pageNumber()).isEqualTo(1);
				assertThat(checkpoint.extra()).containsEntry("pause_reason", "user_requested")
					.containsEntry("paused_at_page", 1);
			});
		}

		@Test
		@DisplayName("Should cancel at the next page boundary with a cancelled checkpoint")
		void shouldCancel() {
			threePages();
			AtomicBoolean cancel = new AtomicBoolean();
			ExtractionRun<String> run = paginator.extract(JOB, filters(2), null, recorder, runId -> cancel.get(),
					ControlSignal.never());

			run.next();
			run.next();
			cancel.set(true);

			assertThat(run.hasNext()).isFalse();
			assertThat(run.state()).isEqualTo(RunState.CANCELLED);
			assertThat(fetcher.requests).hasSize(1);
			assertThat(checkpoints).singleElement().satisfies(checkpoint -> {
				assertThat(checkpoint.phase()).isEqualTo(CheckpointPhase.CANCELLED);
				assertThat(checkpoint.cursor()).isEqualTo("p1");
				assertThat(checkpoint.recordsProcessed()).isEqualTo(2);
				assertThat(checkpoint.extra()).containsEntry("cancellation_reason", "user_requested")
					.containsEntry("cancelled_at_page", 1);
			});
		}

		@Test
		@DisplayName("Should not fetch anything when cancelled before the first page")
		void shouldCancelBeforeFirstPage() {
			threePages();
			ExtractionRun<String> run = paginator.extract(JOB, filters(2), null, recorder, runId -> true,
					ControlSignal.never());

			assertThat(drain(run)).isEmpty();
			assertThat(fetcher.requests).isEmpty();
			assertThat(run.state()).isEqualTo(RunState.CANCELLED);
		}

	}

	@Nested
	@DisplayName("Error Handling Tests")
	class ErrorHandlingTest {

		@Test
		@DisplayName("Should write an error checkpoint and rethrow when a fetch fails")
		void shouldCheckpointFetchError() {
			fetcher.page(null, page("p1", "1", "2"));
			CrmApiException failure = new CrmApiException("Listing deals failed with HTTP 500", 500, "");
			fetcher.fail("p1", failure);
			ExtractionRun<String> run = start(filters(2));
			List<String> out = new ArrayList<>();

			assertThatThrownBy(() -> {
				while (run.hasNext()) {
					out.add(run.next());
				}
			}).isSameAs(failure);

			assertThat(out).containsExactly("1", "2");
			assertThat(run.state()).isEqualTo(RunState.ERRORED);
			assertThat(run.hasNext()).isFalse();
			assertThat(checkpoints).singleElement().satisfies(checkpoint -> {
				assertThat(checkpoint.phase()).isEqualTo(CheckpointPhase.ERROR);
				assertThat(checkpoint.cursor()).isEqualTo("p1");
				assertThat(checkpoint.recordsProcessed()).isEqualTo(2);
				assertThat(checkpoint.pageNumber()).isEqualTo(1);
				assertThat(checkpoint.extra()).containsEntry("error", "Listing deals failed with HTTP 500")
					.containsEntry("error_page", 2)
					.containsEntry("recovery_cursor", "p1");
			});
		}

		@Test
		@DisplayName("Should write an error checkpoint and rethrow when a transform fails")
		void shouldCheckpointTransformError() {
			fetcher.page(null, page(null, "1", "bad"));
			CheckpointedPaginator<String> failing = new CheckpointedPaginator<>(fetcher, (record, meta) -> {
				if ("bad".equals(record.id())) {
					throw new IllegalStateException("cannot map record bad");
				}
				return record.id();
			}, "hubspot_deals", Clock.fixed(NOW, ZoneOffset.UTC));
			ExtractionRun<String> run = failing.extract(JOB, filters(2), null, recorder, ControlSignal.never(),
					ControlSignal.never());

			assertThat(run.next()).isEqualTo("1");
			assertThatThrownBy(run::hasNext).isInstanceOf(IllegalStateException.class);

			assertThat(run.state()).isEqualTo(RunState.ERRORED);
			assertThat(checkpoints).extracting(CheckpointState::phase).containsExactly(CheckpointPhase.ERROR);
			assertThat(checkpoints.get(0).recordsProcessed()).isZero();
			assertThat(run.recordsProcessed()).isZero();
		}

		@Test
		@DisplayName("Should keep extracting when checkpoints cannot be saved")
		void shouldSurviveCheckpointFailures() {
			threePages();
			ExtractionRun<String> run = paginator.extract(JOB, filters(2).withCheckpointInterval(1), null,
					(runId, state) -> {
						throw new IOException("disk full");
					}, ControlSignal.never(), ControlSignal.never());

			assertThat(drain(run)).hasSize(5);
			assertThat(run.state()).isEqualTo(RunState.COMPLETED);
			assertThat(run.checkpointFailures()).isEqualTo(4);
			assertThat(run.lastCheckpoint()).hasValueSatisfying(
					checkpoint -> assertThat(checkpoint.phase()).isEqualTo(CheckpointPhase.COMPLETED));
		}

	}

	@Nested
	@DisplayName("Iteration Contract Tests")
	class IterationContractTest {

		@Test
		@DisplayName("Should not fetch before the caller pulls the first record")
		void shouldBeLazy() {
			threePages();

			ExtractionRun<String> run = start(filters(2));

			assertThat(fetcher.requests).isEmpty();
			assertThat(run.state()).isEqualTo(RunState.STARTING);
			assertThat(run.runId()).isEqualTo("scan-1");
		}

		@Test
		@DisplayName("Should fetch one page at a time as records are pulled")
		void shouldFetchOnDemand() {
			threePages();
			ExtractionRun<String> run = start(filters(2));

			run.next();
			run.next();

			assertThat(fetcher.requests).hasSize(1);
		}

		@Test
		@DisplayName("Should throw NoSuchElementException after the run ended")
		void shouldThrowAfterEnd() {
			fetcher.page(null, page(null, "1"));
			ExtractionRun<String> run = start(filters(2));
			drain(run);

			assertThatThrownBy(run::next).isInstanceOf(NoSuchElementException.class)
				.hasMessageContaining("COMPLETED");
		}

		@Test
		@DisplayName("Should expose records as a stream only once")
		void shouldStreamOnce() {
			threePages();
			ExtractionRun<String> run = start(filters(2));

			assertThat(run.stream().collect(Collectors.toList())).containsExactly("1", "2", "3", "4", "5");
			assertThatThrownBy(run::stream).isInstanceOf(IllegalStateException.class);
		}

		@Test
		@DisplayName("Should run without checkpoints or signals through the short form")
		void shouldSupportShortForm() {
			threePages();

			ExtractionRun<String> run = paginator.extract(JOB, filters(2));

			assertThat(drain(run)).hasSize(5);
			assertThat(checkpoints).isEmpty();
			assertThat(run.lastCheckpoint()).isPresent();
		}

		@Test
		@DisplayName("Should abbreviate long cursors in log output")
		void shouldAbbreviateCursor() {
			assertThat(CheckpointedPaginator.abbreviate(null)).isNull();
			assertThat(CheckpointedPaginator.abbreviate("short")).isEqualTo("short");
			assertThat(CheckpointedPaginator.abbreviate("x".repeat(60))).hasSize(53).endsWith("...");
		}

	}

	/**
	 * In-memory {@link PageFetcher} that serves pages by cursor and records every request.
	 */
	static class FakeFetcher implements PageFetcher {

		private static final String FIRST = "<first>";

		final List<PageRequest> requests = new ArrayList<>();

		private final Map<String, PageResult> pages = new HashMap<>();

		private final Map<String, RuntimeException> failures = new HashMap<>();

		void page(String cursor, PageResult result) {
			pages.put(key(cursor), result);
		}

		void fail(String cursor, RuntimeException failure) {
			failures.put(key(cursor), failure);
		}

		List<String> cursors() {
			List<String> cursors = new ArrayList<>();
			for (PageRequest request : requests) {
				cursors.add(request.cursor());
			}
			return cursors;
		}

		@Override
		public PageResult fetch(PageRequest request) {
			requests.add(request);
			String key = key(request.cursor());
			if (failures.containsKey(key)) {
				throw failures.get(key);
			}
			PageResult result = pages.get(key);
			if (result == null) {
				throw new IllegalStateException("No page for cursor " + request.cursor());
			}
			return result;
		}

		private static String key(String cursor) {
			return cursor == null ? FIRST : cursor;
		}

	}

}
