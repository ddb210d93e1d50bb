package com.id.wattlog.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IngestStatus {

    public static final String OK = "ok";
    public static final String IGNORED = "ignored";

    private String status;
    private String reason;

    public static IngestStatus ok() {
        return new IngestStatus(OK, null);
    }

    public static IngestStatus ignored(String reason) {
        return new IngestStatus(IGNORED, reason);
    }
}
