package com.bit.chainsim.ledger;

import com.bit.chainsim.structure.block.Block;
import com.bit.chainsim.structure.block.MiningProof;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
public class LedgerViewTest {

    private static Block child(Block parent, int creator, double t) {
        return Block.create(parent, creator, t, 1.0, MiningProof.forced(0.1, (long) t),
                ("test-" + creator + "@" + t).getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void maintainsSubtreeWeightsAndChildren() {
        Block genesis = Block.genesis();
        LedgerView view = new LedgerView(0, genesis, Block::getWeight);
        Block a = child(genesis, 0, 1);
        Block b = child(genesis, 1, 2);
        Block a1 = child(a, 2, 3);
        view.insert(a, 1);
        view.insert(b, 2);
        view.insert(a1, 3);

        assertEquals(4, view.size());
        assertEquals(3.0, view.subtreeWeight(genesis.getId()));
        assertEquals(2.0, view.subtreeWeight(a.getId()));
        assertEquals(1.0, view.subtreeWeight(b.getId()));
        assertEquals(2, view.children(genesis.getId()).size());
        assertEquals(a.getId(), view.children(genesis.getId()).get(0));
        assertTrue(view.arrivalOrder(a.getId()) < view.arrivalOrder(b.getId()));
        assertEquals(2, view.tips().size());
        assertTrue(view.isClosedUnderAncestry());
        assertEquals(3.0, view.arrivalTime(a1.getId()));
    }

    @Test
    void refusesDanglingAncestorsAndDuplicates() {
        Block genesis = Block.genesis();
        LedgerView view = new LedgerView(0, genesis, Block::getWeight);
        Block a = child(genesis, 0, 1);
        Block a1 = child(a, 0, 2);
        assertThrows(IllegalStateException.class, () -> view.insert(a1, 2));
        view.insert(a, 1);
        assertThrows(IllegalStateException.class, () -> view.insert(a, 1));
        assertThrows(IllegalStateException.class, () -> view.insert(genesis, 1));
        assertFalse(view.contains(a1.getId()));
    }

    @Test
    void headStartsAtGenesisAndMustBePresent() {
        Block genesis = Block.genesis();
        LedgerView view = new LedgerView(3, genesis, Block::getWeight);
        assertEquals(genesis.getId(), view.getHead());
        Block a = child(genesis, 0, 1);
        assertThrows(IllegalArgumentException.class, () -> view.setHead(a.getId()));
        view.insert(a, 1);
        view.setHead(a.getId());
        assertSame(a, view.getHeadBlock());
    }

    @Test
    void blockStoreKeepsFirstInstance() {
        BlockStore store = new BlockStore();
        Block a = child(Block.genesis(), 0, 1);
        Block same = child(Block.genesis(), 0, 1);
        assertEquals(a.getId(), same.getId());
        assertSame(a, store.intern(a));
        assertSame(a, store.intern(same));
        assertEquals(2, store.size());
        assertTrue(store.contains(Block.genesis().getId()));
    }
}
