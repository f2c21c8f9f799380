package com.casekeep.analysis.stage.output;

public interface StageOutput {
}
