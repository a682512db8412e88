package com.parasitereg.controller;

import com.parasitereg.api.dto.MembershipAssignment;
import com.parasitereg.api.dto.MembershipView;
import com.parasitereg.identity.Identity;
import com.parasitereg.registry.ResearcherDirectory;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/researchers")
@RequiredArgsConstructor
public class ResearcherController {

    private final ResearcherDirectory directory;

    @Operation(summary = "查询研究人员所属机构")
    @GetMapping(value = "/{identity}/membership", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<MembershipView> membership(@PathVariable("identity") String identity) {
        return Mono.fromCallable(() -> {
            Identity researcher = CallerHeaders.identity("identity", identity);
            return new MembershipView(researcher.toHex(), directory.membershipOf(researcher).orElse(null));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "指派/改派成员关系（所有者或机构管理员）")
    @PutMapping(value = "/{identity}/membership", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<MembershipView> assign(@RequestHeader(CallerHeaders.CALLER) String callerHeader,
                                       @PathVariable("identity") String identity,
                                       @RequestBody MembershipAssignment body) {
        return Mono.fromCallable(() -> {
            Identity researcher = CallerHeaders.identity("identity", identity);
            directory.setMembership(researcher, body.institutionId(), CallerHeaders.caller(callerHeader));
            return new MembershipView(researcher.toHex(), body.institutionId());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Operation(summary = "撤销成员关系（所有者或当前机构管理员）")
    @DeleteMapping(value = "/{identity}/membership", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<MembershipView> revoke(@RequestHeader(CallerHeaders.CALLER) String callerHeader,
                                       @PathVariable("identity") String identity) {
        return Mono.fromCallable(() -> {
            Identity researcher = CallerHeaders.identity("identity", identity);
            directory.revokeMembership(researcher, CallerHeaders.caller(callerHeader));
            return new MembershipView(researcher.toHex(), null);
        }).subscribeOn(Schedulers.boundedElastic());
    }
}
