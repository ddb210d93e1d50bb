package com.id.wattlog.modules.ingest.rest;

import com.id.wattlog.model.IngestStatus;
import com.id.wattlog.modules.ingest.service.IngestService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("api")
public class IngestRest {

    private final IngestService ingestService;

    public IngestRest(IngestService ingestService) {
        this.ingestService = ingestService;
    }

    @PostMapping({"pico", "watt"})
    public ResponseEntity<IngestStatus> ingest(@RequestBody(required = false) Map<String, Object> body) {
        IngestStatus status = ingestService.ingest(body);
        HttpStatus httpStatus = IngestStatus.OK.equals(status.getStatus()) ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(httpStatus).body(status);
    }
}
