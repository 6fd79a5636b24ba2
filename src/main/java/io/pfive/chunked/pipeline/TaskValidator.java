// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.pipeline;

import io.pfive.chunked.Configuration;
import io.pfive.chunked.chunk.CalendarPeriod;
import io.pfive.chunked.chunk.Chunker;
import io.pfive.chunked.chunk.DateRange;
import io.pfive.chunked.source.DataSource;
import io.pfive.chunked.source.DatasetQuery;
import io.pfive.chunked.task.AnalysisParameters;
import io.pfive.chunked.task.ProcessingMode;
import io.pfive.chunked.util.Ret;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.time.LocalDate;
import java.util.List;
import java.util.SortedMap;

/// Checks that a task can be run before any chunk is dispatched: its product and measurements
/// exist, and there are enough acquisitions for its processing mode.
public abstract class TaskValidator {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    /// Used when the data source does not provide the measurements the task asked for.
    public static final List<String> DEFAULT_MEASUREMENTS =
          List.of("blue", "green", "red", "nir", "swir1", "swir2", "pixel_qa");

    /// The parameters to run with, which may have fallback measurements substituted, and the
    /// dates of all acquisitions in the task's extent.
    public record ValidatedTask (AnalysisParameters parameters, List<LocalDate> dates) { }

    public static Ret<ValidatedTask> validate (AnalysisParameters parameters, ProcessingMode analysisMode,
                                               DataSource dataSource) {
        if (analysisMode != parameters.mode()) {
            return Ret.err(String.format("Analysis %s runs in %s mode, but the task requested %s.",
                  parameters.analysisName(), analysisMode, parameters.mode()));
        }
        if (!Configuration.hasProductPrefix(parameters.platform())) {
            return Ret.err("Unsupported platform: " + parameters.platform());
        }
        String product = parameters.product();
        if (!dataSource.validateMeasurements(product, parameters.measurements())) {
            LOG.info("Product {} does not provide measurements {}, falling back on defaults.", product,
                  parameters.measurements());
            if (!dataSource.validateMeasurements(product, DEFAULT_MEASUREMENTS)) {
                return Ret.err("Product " + product + " does not provide the requested or default measurements.");
            }
            parameters = parameters.withMeasurements(DEFAULT_MEASUREMENTS);
        }
        DateRange extent = new DateRange(parameters.timeStart(), parameters.timeEnd());
        List<LocalDate> dates = dataSource.listAcquisitionDates(
              new DatasetQuery(product, parameters.bounds(), extent, parameters.measurements()));
        if (dates.isEmpty()) {
            return Ret.err("There are no acquisitions for this parameter set.");
        }
        if (parameters.mode() == ProcessingMode.BATCH) {
            CalendarPeriod period = parameters.calendarPeriod();
            String startKey = period.key(parameters.timeStart());
            String endKey = period.key(parameters.timeEnd());
            if (startKey.equals(endKey)) {
                return Ret.err("The start and end of the task must fall in different periods.");
            }
            SortedMap<String, List<LocalDate>> groups = Chunker.groupByPeriod(dates, period);
            if (!groups.containsKey(startKey)) {
                return Ret.err("There are no acquisitions in the starting period " + startKey + ".");
            }
            if (!groups.containsKey(endKey)) {
                return Ret.err("There are no acquisitions in the ending period " + endKey + ".");
            }
        }
        return Ret.ok(new ValidatedTask(parameters, dates));
    }

}
