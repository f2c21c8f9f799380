package com.casekeep.analysis.stage.output;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MessageAnnotationOutput(List<MessageAnnotation> messageAnnotations) implements StageOutput {
}
