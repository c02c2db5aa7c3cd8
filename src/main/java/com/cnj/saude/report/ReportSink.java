package com.cnj.saude.report;

import com.cnj.saude.analysis.AnalysisReport;

import java.io.IOException;

/**
 * Destination for the analysis tables.
 */
public interface ReportSink {

    void publish(AnalysisReport report) throws IOException;
}
