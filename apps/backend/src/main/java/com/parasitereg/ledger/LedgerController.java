package com.parasitereg.ledger;

import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/ledger")
@RequiredArgsConstructor
public class LedgerController {

    private final LedgerVerifyService verifyService;
    private final LedgerExportService exportService;

    @Operation(summary = "账本哈希链校验，返回 JSON 报告")
    @GetMapping(value = "/verify", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<LedgerVerifyService.Report> verify() {
        return Mono.fromCallable(verifyService::verify)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "获取链尾哈希（tailHash）")
    @GetMapping(value = "/tail", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<LedgerVerifyService.Tail> tail() {
        return Mono.fromCallable(verifyService::tail) // 空账本时 tailHash 为 null
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "导出 CSV（流式）")
    @GetMapping(value = "/export/csv", produces = "text/csv")
    public Mono<Void> exportCsv(ServerHttpResponse resp) {
        return exportService.streamCsv(resp);
    }

    @Operation(summary = "导出 NDJSON（流式，逐行）")
    @GetMapping(value = "/export/ndjson", produces = "application/x-ndjson")
    public Mono<Void> exportNdjson(ServerHttpResponse resp) {
        return exportService.streamNdjson(resp);
    }
}
