package com.jimin.reader.service.job;

import com.jimin.reader.entity.Job;
import com.jimin.reader.entity.JobType;
import com.jimin.reader.entity.Source;
import com.jimin.reader.exception.JobNotFoundException;
import com.jimin.reader.support.IntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobQueueServiceTest extends IntegrationTest {

    @Autowired
    private JobQueueService jobQueueService;

    @Test
    void claimsDueJobAndMarksItRunning() {
        Job job = newJob("https://a.example.com/rss");

        Optional<Job> claimed = jobQueueService.claimNext();

        assertThat(claimed).isPresent();
        assertThat(claimed.get().getId()).isEqualTo(job.getId());
        assertThat(claimed.get().getRunningSince()).isEqualTo(clock.instant());
        // 실행 중인 Job 은 다시 claim 되지 않는다
        assertThat(jobQueueService.claimNext()).isEmpty();
    }

    @Test
    void emptyQueueIsNotAnError() {
        assertThat(jobQueueService.claimNext()).isEmpty();
    }

    @Test
    void skipsDisabledAndFutureJobs() {
        Job disabled = newJob("https://disabled.example.com/rss");
        disabled.setEnabled(false);
        jobRepository.save(disabled);

        Job future = newJob("https://future.example.com/rss");
        future.setNextRunAt(clock.instant().plus(Duration.ofMinutes(10)));
        jobRepository.save(future);

        assertThat(jobQueueService.claimNext()).isEmpty();

        clock.advance(Duration.ofMinutes(10));
        assertThat(jobQueueService.claimNext()).map(Job::getId).contains(future.getId());
    }

    @Test
    void claimsOldestDueJobFirst() {
        Job later = newJob("https://later.example.com/rss");
        Job earlier = newJob("https://earlier.example.com/rss");
        earlier.setNextRunAt(clock.instant().minus(Duration.ofHours(1)));
        jobRepository.save(earlier);

        assertThat(jobQueueService.claimNext()).map(Job::getId).contains(earlier.getId());
        assertThat(jobQueueService.claimNext()).map(Job::getId).contains(later.getId());
    }

    @Test
    void staleRunningJobIsReclaimed() {
        Job job = newJob("https://stale.example.com/rss");
        assertThat(jobQueueService.claimNext()).isPresent();

        clock.advance(Duration.ofMinutes(4));
        assertThat(jobQueueService.claimNext()).isEmpty();

        clock.advance(Duration.ofMinutes(2));
        Optional<Job> reclaimed = jobQueueService.claimNext();
        assertThat(reclaimed).map(Job::getId).contains(job.getId());
        assertThat(reclaimed.get().getRunningSince()).isEqualTo(clock.instant());
    }

    @Test
    void finishSuccessClearsRunningAndResetsFailures() {
        Job job = newJob("https://ok.example.com/rss");
        job.setConsecutiveFailures(3);
        job.setLastError("boom");
        jobRepository.save(job);
        jobQueueService.claimNext();

        Instant next = clock.instant().plus(Duration.ofHours(1));
        Job finished = jobQueueService.finish(job.getId(), JobOutcome.succeeded(next));

        assertThat(finished.getRunningSince()).isNull();
        assertThat(finished.getLastRunAt()).isEqualTo(clock.instant());
        assertThat(finished.getNextRunAt()).isEqualTo(next);
        assertThat(finished.getConsecutiveFailures()).isZero();
        assertThat(finished.getLastError()).isNull();
    }

    @Test
    void finishFailureIncrementsFailures() {
        Job job = newJob("https://broken.example.com/rss");
        jobQueueService.claimNext();

        Instant next = clock.instant().plus(Duration.ofMinutes(30));
        jobQueueService.finish(job.getId(), JobOutcome.failed(next, "HTTP 500"));
        Job finished = jobQueueService.finish(job.getId(), JobOutcome.failed(next, "HTTP 502"));

        assertThat(finished.getRunningSince()).isNull();
        assertThat(finished.getConsecutiveFailures()).isEqualTo(2);
        assertThat(finished.getLastError()).isEqualTo("HTTP 502");
        assertThat(finished.getNextRunAt()).isEqualTo(next);
    }

    @Test
    void finishUnknownJobThrows() {
        assertThatThrownBy(() -> jobQueueService.finish(999_999L, JobOutcome.succeeded(clock.instant())))
                .isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void finishIsRecordedEvenIfDisabledMeanwhile() {
        Job job = newJob("https://gone.example.com/rss");
        jobQueueService.claimNext();
        Job reloaded = jobRepository.findById(job.getId()).orElseThrow();
        reloaded.setEnabled(false);
        jobRepository.save(reloaded);

        Job finished = jobQueueService.finish(job.getId(), JobOutcome.succeeded(clock.instant()));

        assertThat(finished.isEnabled()).isFalse();
        assertThat(finished.getRunningSince()).isNull();
        assertThat(jobQueueService.claimNext()).isEmpty();
    }

    @Test
    void ensureFetchJobNeverDuplicates() {
        Source source = newSource("https://dup.example.com/rss");

        Job first = jobQueueService.ensureFetchJob(source.getId());
        Job second = jobQueueService.ensureFetchJob(source.getId());

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(jobRepository.count()).isEqualTo(1);
        assertThat(jobQueueService.findFetchJob(source.getId())).map(Job::getType).contains(JobType.FETCH_SOURCE);
    }

    @Test
    void runNowMakesJobDueImmediately() {
        Job job = newJob("https://manual.example.com/rss");
        job.setNextRunAt(clock.instant().plus(Duration.ofDays(3)));
        jobRepository.save(job);

        assertThat(jobQueueService.runNow(job.getSourceId())).isTrue();
        assertThat(jobQueueService.claimNext()).map(Job::getId).contains(job.getId());
        assertThat(jobQueueService.runNow(123_456L)).isFalse();
    }

    @Test
    void concurrentClaimsNeverHandOutTheSameJobTwice() throws Exception {
        int jobCount = 20;
        for (int i = 0; i < jobCount; i++) {
            newJob("https://concurrent.example.com/rss/" + i);
        }

        int workers = 6;
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        List<Long> claimed = Collections.synchronizedList(new ArrayList<>());
        List<Callable<Void>> tasks = new ArrayList<>();
        for (int i = 0; i < workers; i++) {
            tasks.add(() -> {
                start.await();
                Optional<Job> job;
                while ((job = jobQueueService.claimNext()).isPresent()) {
                    claimed.add(job.get().getId());
                }
                return null;
            });
        }
        List<Future<Void>> futures = new ArrayList<>();
        for (Callable<Void> task : tasks) {
            futures.add(executor.submit(task));
        }
        start.countDown();
        for (Future<Void> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // 경쟁에서 진 워커가 일찍 빠졌을 수 있으니 남은 것도 수거
        Optional<Job> rest;
        while ((rest = jobQueueService.claimNext()).isPresent()) {
            claimed.add(rest.get().getId());
        }

        assertThat(claimed).hasSize(jobCount).doesNotHaveDuplicates();
    }

    private Source newSource(String url) {
        Source source = new Source();
        source.setUrl(url);
        return sourceRepository.save(source);
    }

    private Job newJob(String url) {
        return jobQueueService.ensureFetchJob(newSource(url).getId());
    }
}
