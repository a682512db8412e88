package com.parasitereg.controller;

import com.parasitereg.registry.GeoStatsAggregator;
import com.parasitereg.registry.model.GeoStat;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 只读。地区名可能含空格和逗号，所以走查询参数而不是路径变量。
 */
@RestController
@RequestMapping("/geo-stats")
@RequiredArgsConstructor
public class GeoStatsController {

    private final GeoStatsAggregator aggregator;

    @Operation(summary = "按地区查询累计病例数")
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<GeoStat>> get(@RequestParam("region") String region) {
        return Mono.fromCallable(() -> aggregator.get(region)
                        .map(ResponseEntity::ok)
                        .orElseGet(() -> ResponseEntity.notFound().build()))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
