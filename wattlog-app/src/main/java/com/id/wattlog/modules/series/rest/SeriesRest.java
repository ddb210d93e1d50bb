package com.id.wattlog.modules.series.rest;

import com.id.wattlog.errors.InvalidInputException;
import com.id.wattlog.model.LatestReading;
import com.id.wattlog.model.SeriesPoint;
import com.id.wattlog.modules.series.model.SeriesOverrides;
import com.id.wattlog.modules.series.model.SeriesWindow;
import com.id.wattlog.modules.series.service.SeriesService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("api")
public class SeriesRest {

    private static final String MODE_RAW = "raw";

    private final SeriesService seriesService;

    public SeriesRest(SeriesService seriesService) {
        this.seriesService = seriesService;
    }

    @GetMapping("watt_now")
    public ResponseEntity<LatestReading> latest() {
        return ResponseEntity.ok(seriesService.latest());
    }

    @GetMapping("watt_24h")
    public ResponseEntity<List<SeriesPoint>> last24Hours(@RequestParam(value = "mode", required = false) String mode,
                                                         @RequestParam(value = "aggregation", required = false) String aggregation,
                                                         @RequestParam(value = "column", required = false) String column,
                                                         @RequestParam(value = "missing", required = false) String missing,
                                                         @RequestParam(value = "fill", required = false) Boolean fill) {
        if (MODE_RAW.equalsIgnoreCase(mode)) {
            return ResponseEntity.ok(seriesService.raw(SeriesWindow.H24));
        }
        if (mode != null && !mode.equalsIgnoreCase("bucketed")) {
            throw new InvalidInputException("Unsupported mode: " + mode);
        }
        return ResponseEntity.ok(seriesService.window(SeriesWindow.H24, SeriesOverrides.fromParams(aggregation, column, missing, fill)));
    }

    @GetMapping("watt_7d")
    public ResponseEntity<List<SeriesPoint>> last7Days(@RequestParam(value = "aggregation", required = false) String aggregation,
                                                       @RequestParam(value = "column", required = false) String column,
                                                       @RequestParam(value = "missing", required = false) String missing,
                                                       @RequestParam(value = "fill", required = false) Boolean fill) {
        return ResponseEntity.ok(seriesService.window(SeriesWindow.D7, SeriesOverrides.fromParams(aggregation, column, missing, fill)));
    }

    @GetMapping("watt_30d")
    public ResponseEntity<List<SeriesPoint>> last30Days(@RequestParam(value = "aggregation", required = false) String aggregation,
                                                        @RequestParam(value = "column", required = false) String column,
                                                        @RequestParam(value = "missing", required = false) String missing,
                                                        @RequestParam(value = "fill", required = false) Boolean fill) {
        return ResponseEntity.ok(seriesService.window(SeriesWindow.D30, SeriesOverrides.fromParams(aggregation, column, missing, fill)));
    }

    @GetMapping("watt_12monate")
    public ResponseEntity<List<SeriesPoint>> last12Months(@RequestParam(value = "aggregation", required = false) String aggregation,
                                                          @RequestParam(value = "column", required = false) String column,
                                                          @RequestParam(value = "missing", required = false) String missing,
                                                          @RequestParam(value = "fill", required = false) Boolean fill) {
        return ResponseEntity.ok(seriesService.window(SeriesWindow.M12, SeriesOverrides.fromParams(aggregation, column, missing, fill)));
    }
}
