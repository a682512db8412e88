package com.parasitereg.controller;

import com.parasitereg.api.dto.InstitutionRegistration;
import com.parasitereg.registry.InstitutionRegistry;
import com.parasitereg.registry.model.Institution;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/institutions")
@RequiredArgsConstructor
public class InstitutionController {

    private final InstitutionRegistry registry;

    @Operation(summary = "注册机构（仅注册表所有者）")
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Map<String, Object>>> register(@RequestHeader(CallerHeaders.CALLER) String callerHeader,
                                                              @RequestBody InstitutionRegistration body) {
        return Mono.fromCallable(() -> {
            registry.registerInstitution(body.id(), body.name(), CallerHeaders.caller(callerHeader));
            return ResponseEntity.status(HttpStatus.CREATED).body(Map.<String, Object>of("ok", true, "id", body.id()));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "认证机构（仅注册表所有者，幂等）")
    @PostMapping(value = "/{id}/verify", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> verify(@RequestHeader(CallerHeaders.CALLER) String callerHeader,
                                            @PathVariable("id") String id) {
        return Mono.fromCallable(() -> {
            registry.verifyInstitution(id, CallerHeaders.caller(callerHeader));
            return Map.<String, Object>of("ok", true);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "机构详情")
    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Institution>> get(@PathVariable("id") String id) {
        return Mono.fromCallable(() -> registry.getInstitution(id)
                        .map(ResponseEntity::ok)
                        .orElseGet(() -> ResponseEntity.notFound().build()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "列出全部机构（按 id 排序）")
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<Institution>> list() {
        return Mono.fromCallable(registry::listInstitutions)
                .subscribeOn(Schedulers.boundedElastic());
    }
}
