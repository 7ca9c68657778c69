package at.sv.milkyway;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Calculates reports for consecutive nights, one task per night.
 */
@Slf4j
public final class NightCalendar {

    private final NightReportCalculator calculator;
    private final ExecutorService executor;

    public NightCalendar(NightReportCalculator calculator, ExecutorService executor) {
        this.calculator = calculator;
        this.executor = executor;
    }

    /**
     * @return the reports ordered by date
     * @throws IllegalStateException if a night could not be calculated or the calling thread was interrupted
     */
    public List<NightReport> calculate(LocalDate firstNight, int nights, Location location, ZoneId zone) {
        List<Future<NightReport>> futures = new ArrayList<>();
        for (int i = 0; i < nights; i++) {
            LocalDate date = firstNight.plusDays(i);
            futures.add(executor.submit(() -> calculateWithContext(date, location, zone)));
        }
        List<NightReport> reports = new ArrayList<>();
        for (Future<NightReport> future : futures) {
            reports.add(await(future));
        }
        reports.sort(Comparator.comparing(NightReport::getDate));
        return reports;
    }

    private NightReport calculateWithContext(LocalDate date, Location location, ZoneId zone) {
        MDC.put("context", date.toString());
        try {
            return calculator.calculate(date, location, zone);
        } finally {
            MDC.remove("context");
        }
    }

    private static NightReport await(Future<NightReport> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for night report", e);
        } catch (ExecutionException e) {
            log.error("Failed to calculate night report: {}", e.getCause().getLocalizedMessage(), e.getCause());
            throw new IllegalStateException("Failed to calculate night report", e.getCause());
        }
    }
}
