package com.casekeep.analysis.result;

import java.util.List;

public record AssembledResult(AnalysisResult result, List<String> warnings) {
}
