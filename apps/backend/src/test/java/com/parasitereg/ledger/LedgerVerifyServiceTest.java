package com.parasitereg.ledger;

import com.parasitereg.TestIdentities;
import com.parasitereg.identity.Identity;
import com.parasitereg.registry.RegistryError;
import com.parasitereg.registry.RegistryException;
import com.parasitereg.registry.RegistryFixture;
import com.parasitereg.registry.model.RecordStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LedgerVerifyServiceTest {

    private final RegistryFixture fx = new RegistryFixture();
    private final Identity p = TestIdentities.named("P");
    private LedgerVerifyService service;

    @BeforeEach
    void setUp() {
        service = new LedgerVerifyService(fx.records, fx.objectMapper);
        fx.verifiedMember(p, "WHO_AFRICA");
        long id = fx.records.addRecord("Plasmodium vivax", "Apicomplexan", "South Asia", TestIdentities.hash("1"), p);
        fx.records.addRecord("Toxoplasma gondii", "Apicomplexan", "Europe", TestIdentities.hash("2"), p);
        fx.records.updateRecord(id, "Plasmodium vivax", "Apicomplexan", "South Asia", TestIdentities.hash("3"), p);
    }

    @Test
    void emptyLedgerVerifiesWithoutTail() {
        LedgerVerifyService.Report report = new LedgerVerifyService(new RegistryFixture().records, fx.objectMapper).verify();

        assertThat(report.ok()).isTrue();
        assertThat(report.totalNodes()).isZero();
        assertThat(report.tailHash()).isNull();
    }

    @Test
    void intactLedgerVerifiesAndTailMatchesStore() {
        LedgerVerifyService.Report report = service.verify();

        assertThat(report.ok()).isTrue();
        assertThat(report.totalNodes()).isEqualTo(3);
        assertThat(report.firstBadIndex()).isNull();
        assertThat(report.tailHash()).isEqualTo(fx.records.getTailHash().orElseThrow());
    }

    @Test
    void tailReadsStoredAnchorWithoutReplay() {
        LedgerVerifyService.Tail tail = service.tail();

        assertThat(tail.totalNodes()).isEqualTo(3);
        assertThat(tail.tailHash()).isEqualTo(service.verify().tailHash());
    }

    @Test
    void archivalDoesNotBreakTheChain() {
        // record 1 在链接之后被归档，status 不参与哈希
        assertThat(fx.records.getRecord(1).orElseThrow().getStatus()).isEqualTo(RecordStatus.ARCHIVED);
        assertThat(service.verify().ok()).isTrue();
    }

    @Test
    void tamperedRecordContentIsReportedAtItsIndex() {
        List<LedgerEntry> rows = new ArrayList<>(service.fetchTimeline());
        LedgerEntry second = rows.get(1);
        rows.set(1, new LedgerEntry(second.record().toBuilder().location("Antarctica").build(), second.link()));

        LedgerVerifyService.Report report = service.verifyTimeline(rows);

        assertThat(report.ok()).isFalse();
        assertThat(report.firstBadIndex()).isEqualTo(1);
        assertThat(report.breaks()).hasSize(1);
        LedgerVerifyService.Break br = report.breaks().get(0);
        assertThat(br.getRecordId()).isEqualTo(2);
        assertThat(br.isCanonicalMatch()).isFalse();
        assertThat(br.isHashMatch()).isTrue();
    }

    @Test
    void rewrittenLinkBreaksItselfAndItsSuccessor() {
        List<LedgerEntry> rows = new ArrayList<>(service.fetchTimeline());
        LedgerEntry first = rows.get(0);
        LedgerLink forged = LedgerHasher.link(1, null, first.link().canonical().replace("South Asia", "Europe"));
        rows.set(0, new LedgerEntry(first.record(), forged));

        LedgerVerifyService.Report report = service.verifyTimeline(rows);

        assertThat(report.ok()).isFalse();
        assertThat(report.firstBadIndex()).isZero();
        assertThat(report.breaks()).extracting(LedgerVerifyService.Break::getIndex).containsExactly(0, 1);
        assertThat(report.breaks().get(1).isPrevMatch()).isFalse();
    }

    @Test
    void verifyRecordChecksLineageAndLink() {
        LedgerVerifyService.RecordVerification latest = service.verifyRecord(3);
        assertThat(latest.verified()).isTrue();
        assertThat(latest.issues()).isEmpty();
        assertThat(latest.version()).isEqualTo(2);
        assertThat(latest.lineageLength()).isEqualTo(2);
        assertThat(latest.status()).isEqualTo(RecordStatus.ACTIVE);
        assertThat(latest.chainHash()).isEqualTo(fx.records.getTailHash().orElseThrow());

        LedgerVerifyService.RecordVerification archived = service.verifyRecord(1);
        assertThat(archived.verified()).isTrue();
        assertThat(archived.status()).isEqualTo(RecordStatus.ARCHIVED);

        assertThatThrownBy(() -> service.verifyRecord(42))
                .isInstanceOf(RegistryException.class)
                .extracting("error").isEqualTo(RegistryError.INVALID_RECORD);
    }
}
