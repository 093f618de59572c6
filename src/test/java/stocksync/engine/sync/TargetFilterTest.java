package stocksync.engine.sync;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TargetFilterTest {

    @Test
    void tradableDropsFlaggedAndInactiveTargets() {
        List<SyncTarget> targets = List.of(
                SyncTarget.of("600000.SH", "浦发银行", null),
                SyncTarget.of("600001.SH", "ST 某公司", null),
                SyncTarget.of("600002.SH", "*ST 另一家", null),
                SyncTarget.of("600003.SH", "某某退", null),
                new SyncTarget("600004.SH", "停牌公司", false, null),
                SyncTarget.of("000001.SZ", "平安银行", null));

        List<SyncTarget> eligible = TargetFilter.tradable().apply(targets);

        assertEquals(List.of("600000.SH", "000001.SZ"), eligible.stream().map(SyncTarget::tsCode).toList());
    }

    @Test
    void activeOnlyKeepsFlaggedNames() {
        List<SyncTarget> eligible = TargetFilter.activeOnly().apply(List.of(
                SyncTarget.of("600001.SH", "ST 某公司", null),
                new SyncTarget("600004.SH", "停牌公司", false, null)));

        assertEquals(1, eligible.size());
        assertEquals("600001.SH", eligible.get(0).tsCode());
    }

    @Test
    void duplicatesKeepFirstOccurrence() {
        List<SyncTarget> eligible = TargetFilter.tradable().apply(List.of(
                SyncTarget.of("600000.SH", "first", null),
                SyncTarget.of("600000.SH", "second", null)));

        assertEquals(1, eligible.size());
        assertEquals("first", eligible.get(0).name());
    }
}
