package com.casekeep.analysis.stage.output;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MessageAnnotation(String messageId, List<Flag> flags) {

    public MessageAnnotation withFlags(List<Flag> retained) {
        return new MessageAnnotation(messageId, retained);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Flag(
        String type,
        String description,
        String attributedToPersonId,
        String severity,
        String evidence,
        String impact
    ) {

        @JsonIgnore
        public boolean isAttributed() {
            return notBlank(type) && notBlank(attributedToPersonId) && notBlank(description);
        }

        private static boolean notBlank(String value) {
            return value != null && !value.isBlank();
        }
    }
}
