package dev.granary.analysis;

/** Reads a document and returns its content. Failures are reported in the result. */
public interface DocumentAnalyzer {

  AnalysisResult analyze(AnalysisRequest request);
}
