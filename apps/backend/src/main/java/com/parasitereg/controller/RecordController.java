package com.parasitereg.controller;

import com.parasitereg.api.dto.RecordCreated;
import com.parasitereg.api.dto.RecordSubmission;
import com.parasitereg.identity.Identity;
import com.parasitereg.ledger.LedgerVerifyService;
import com.parasitereg.registry.RecordStore;
import com.parasitereg.registry.model.ParasiteRecord;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/records")
@RequiredArgsConstructor
public class RecordController {

    private final RecordStore recordStore;
    private final LedgerVerifyService verifyService;

    @Operation(summary = "新增寄生虫记录（需要已认证机构的成员身份）")
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<RecordCreated> add(@RequestHeader(CallerHeaders.CALLER) String callerHeader,
                                   @RequestBody RecordSubmission body) {
        return Mono.fromCallable(() -> {
            Identity caller = CallerHeaders.caller(callerHeader);
            long id = recordStore.addRecord(body.parasiteName(), body.classification(), body.location(),
                    CallerHeaders.metadataHash(body.metadataHash()), caller);
            return new RecordCreated(id);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "更新记录：归档旧版本并追加新版本（作者或机构管理员）")
    @PostMapping(value = "/{id}/versions", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<RecordCreated> update(@RequestHeader(CallerHeaders.CALLER) String callerHeader,
                                      @PathVariable("id") long id,
                                      @RequestBody RecordSubmission body) {
        return Mono.fromCallable(() -> {
            Identity caller = CallerHeaders.caller(callerHeader);
            long created = recordStore.updateRecord(id, body.parasiteName(), body.classification(),
                    body.location(), CallerHeaders.metadataHash(body.metadataHash()), caller);
            return new RecordCreated(created);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "按 id 查询记录")
    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ParasiteRecord>> get(@PathVariable("id") long id) {
        return Mono.fromCallable(() -> recordStore.getRecord(id)
                        .map(ResponseEntity::ok)
                        .orElseGet(() -> ResponseEntity.notFound().build()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "完整版本历史（新 -> 旧）")
    @GetMapping(value = "/{id}/history", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<ParasiteRecord>> history(@PathVariable("id") long id) {
        return Mono.fromCallable(() -> recordStore.getRecordHistory(id))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "该谱系的最新版本")
    @GetMapping(value = "/{id}/latest", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ParasiteRecord> latest(@PathVariable("id") long id) {
        return Mono.fromCallable(() -> recordStore.getLatestVersion(id))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "校验单条记录的谱系与账本哈希")
    @GetMapping(value = "/{id}/verify", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<LedgerVerifyService.RecordVerification> verify(@PathVariable("id") long id) {
        return Mono.fromCallable(() -> verifyService.verifyRecord(id))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "已分配的记录总数")
    @GetMapping(value = "/count", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> count() {
        return Mono.fromCallable(() -> Map.<String, Object>of("totalRecords", recordStore.getTotalRecords()))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
