package com.parasitereg.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.parasitereg.registry.model.ParasiteRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class LedgerExportService {

    static final String CSV_HEADER =
            "id,version,previous_version,status,recorded_at,author,parasite_name,classification,location,metadata_hash,prev_hash,hash\n";

    private final LedgerVerifyService verifyService;
    private final ObjectMapper objectMapper;

    /** CSV 流式导出 */
    public Mono<Void> streamCsv(ServerHttpResponse resp) {
        resp.getHeaders().setContentType(MediaType.parseMediaType("text/csv; charset=UTF-8"));
        resp.getHeaders().setContentDisposition(ContentDisposition.attachment()
                .filename("ledger.csv", StandardCharsets.UTF_8).build());

        DataBufferFactory buf = resp.bufferFactory();

        Flux<DataBuffer> body = Mono.fromCallable(verifyService::fetchTimeline)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(list -> Flux.just(CSV_HEADER)
                        .concatWith(Flux.fromIterable(list).map(LedgerExportService::toCsvLine)))
                .map(s -> buf.wrap(s.getBytes(StandardCharsets.UTF_8)));

        return resp.writeWith(body);
    }

    /** NDJSON 流式导出（逐行一条 JSON） */
    public Mono<Void> streamNdjson(ServerHttpResponse resp) {
        resp.getHeaders().setContentType(MediaType.parseMediaType("application/x-ndjson; charset=UTF-8"));
        resp.getHeaders().setContentDisposition(ContentDisposition.attachment()
                .filename("ledger.ndjson", StandardCharsets.UTF_8).build());

        DataBufferFactory buf = resp.bufferFactory();

        Flux<DataBuffer> body = Mono.fromCallable(verifyService::fetchTimeline)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(Flux::fromIterable)
                .map(this::toNdjsonLine)
                .map(s -> buf.wrap(s.getBytes(StandardCharsets.UTF_8)));

        return resp.writeWith(body);
    }

    String toNdjsonLine(LedgerEntry entry) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("record", entry.record());
        LedgerLink link = entry.link();
        if (link != null) {
            row.put("prevHash", link.prevHash());
            row.put("hash", link.hash());
        }
        try {
            return objectMapper.writeValueAsString(row) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize ledger entry " + entry.record().getId(), e);
        }
    }

    static String toCsvLine(LedgerEntry entry) {
        ParasiteRecord r = entry.record();
        LedgerLink link = entry.link();
        return r.getId() + ","
                + r.getVersion() + ","
                + csv(r.getPreviousVersion()) + ","
                + r.getStatus() + ","
                + r.getRecordedAt() + ","
                + csv(r.getAuthor()) + ","
                + csv(r.getParasiteName()) + ","
                + csv(r.getClassification()) + ","
                + csv(r.getLocation()) + ","
                + csv(r.getMetadataHash()) + ","
                + csv(link == null ? null : link.prevHash()) + ","
                + csv(link == null ? null : link.hash()) + "\n";
    }

    private static String csv(Object v) {
        if (v == null) return "";
        String s = String.valueOf(v);
        boolean q = s.contains(",") || s.contains("\"") || s.contains("\n");
        if (q) s = "\"" + s.replace("\"", "\"\"") + "\"";
        return s;
    }
}
