package com.bit.chainsim.consensus;

import com.bit.chainsim.consensus.impl.LongestChainEngine;
import com.bit.chainsim.ledger.LedgerView;
import com.bit.chainsim.structure.block.Block;
import com.bit.chainsim.structure.block.MiningProof;
import com.bit.chainsim.structure.event.MiningTrial;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.Random;

import static com.bit.chainsim.consensus.ConsensusTestBlocks.mine;
import static com.bit.chainsim.consensus.ConsensusTestBlocks.mineInto;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
public class LongestChainEngineTest {

    private final WeightTable weights = WeightTable.of(1, 1, 1, 1);

    private LongestChainEngine engine(TieBreak tieBreak) {
        return new LongestChainEngine(weights, 0.1, 1.0, tieBreak);
    }

    @Test
    void picksTallestChain() {
        LongestChainEngine engine = engine(TieBreak.FIRST_SEEN);
        LedgerView view = new LedgerView(0, Block.genesis(), engine::weightOf);
        Block a1 = mineInto(view, engine, Block.genesis(), 0, 1);
        Block a2 = mineInto(view, engine, a1, 0, 2);
        mineInto(view, engine, Block.genesis(), 1, 1.5);
        assertEquals(a2.getId(), engine.selectHead(view));
    }

    @Test
    void firstSeenBreaksTies() {
        LongestChainEngine engine = engine(TieBreak.FIRST_SEEN);
        LedgerView view = new LedgerView(0, Block.genesis(), engine::weightOf);
        Block first = mineInto(view, engine, Block.genesis(), 2, 1);
        mineInto(view, engine, Block.genesis(), 1, 1);
        assertEquals(first.getId(), engine.selectHead(view));
    }

    @Test
    void lowestIdBreaksTiesIndependentOfArrival() {
        LongestChainEngine engine = engine(TieBreak.LOWEST_ID);
        Block x = mine(engine, Block.genesis(), 1, 1);
        Block y = mine(engine, Block.genesis(), 2, 1);
        Block lower = x.getId().compareTo(y.getId()) < 0 ? x : y;

        LedgerView forward = new LedgerView(0, Block.genesis(), engine::weightOf);
        forward.insert(x, 1);
        forward.insert(y, 1);
        LedgerView backward = new LedgerView(1, Block.genesis(), engine::weightOf);
        backward.insert(y, 1);
        backward.insert(x, 1);
        assertEquals(lower.getId(), engine.selectHead(forward));
        assertEquals(lower.getId(), engine.selectHead(backward));
    }

    @Test
    void rejectsMalformedBlocks() {
        LongestChainEngine engine = engine(TieBreak.FIRST_SEEN);
        LedgerView view = new LedgerView(0, Block.genesis(), engine::weightOf);
        Block parent = mineInto(view, engine, Block.genesis(), 0, 1);
        byte[] payload = "bad".getBytes(StandardCharsets.UTF_8);
        MiningProof good = MiningProof.forced(engine.thresholdFor(1), 2);

        Block wrongHeight = Block.of(parent.getId(), 1, 2, 5, 1.0, good, payload);
        assertNotNull(engine.rejectionReason(wrongHeight, view));

        Block earlier = Block.of(parent.getId(), 1, 0.5, 2, 1.0, good, payload);
        assertNotNull(engine.rejectionReason(earlier, view));

        Block failedRoll = Block.of(parent.getId(), 1, 2, 2, 1.0,
                new MiningProof(0.99, engine.thresholdFor(1), 2), payload);
        assertNotNull(engine.rejectionReason(failedRoll, view));

        Block inflatedThreshold = Block.of(parent.getId(), 1, 2, 2, 1.0, MiningProof.forced(1.0, 2), payload);
        assertNotNull(engine.rejectionReason(inflatedThreshold, view));

        Block unknownCreator = Block.of(parent.getId(), 9, 2, 2, 1.0, good, payload);
        assertNotNull(engine.rejectionReason(unknownCreator, view));

        Block orphan = Block.of(unknownCreator.getId(), 1, 3, 3, 1.0, good, payload);
        assertNotNull(engine.rejectionReason(orphan, view));

        Block valid = Block.of(parent.getId(), 1, 2, 2, 1.0, good, payload);
        assertNull(engine.rejectionReason(valid, view));
        assertTrue(engine.validate(valid, view));
        assertFalse(engine.validate(null, view));
    }

    @Test
    void trialSucceedsAtConfiguredRate() {
        LongestChainEngine engine = engine(TieBreak.FIRST_SEEN);
        Random rng = new Random(5);
        int successes = 0;
        for (int i = 0; i < 10_000; i++) {
            Optional<MiningProof> proof = engine.attemptTrial(0, Block.genesis(), i, MiningTrial.RANDOM, rng);
            if (proof.isPresent()) {
                assertTrue(proof.get().isSuccessful());
                successes++;
            }
        }
        log.info("10000 次试验成功 {} 次", successes);
        assertTrue(successes > 850 && successes < 1150);
        assertTrue(engine.attemptTrial(0, Block.genesis(), 0, MiningTrial.FORCED, rng).isPresent());
    }

    @Test
    void thresholdScalesWithWeightShare() {
        LongestChainEngine engine = new LongestChainEngine(WeightTable.of(3, 1), 0.2, 1.0, TieBreak.FIRST_SEEN);
        assertEquals(0.3, engine.thresholdFor(0), 1e-12);
        assertEquals(0.1, engine.thresholdFor(1), 1e-12);
    }

    @Test
    void zeroWeightNodeNeverWinsTrial() {
        LongestChainEngine engine = new LongestChainEngine(WeightTable.of(1, 0), 0.5, 1.0, TieBreak.FIRST_SEEN);
        Random rng = new Random(3);
        assertEquals(0.0, engine.thresholdFor(1));
        assertFalse(engine.attemptTrial(1, Block.genesis(), 0, MiningTrial.FORCED, rng).isPresent());
        for (int i = 0; i < 100; i++) {
            assertFalse(engine.attemptTrial(1, Block.genesis(), i, MiningTrial.RANDOM, rng).isPresent());
        }
        assertTrue(engine.attemptTrial(0, Block.genesis(), 0, MiningTrial.FORCED, rng).isPresent());
    }
}
