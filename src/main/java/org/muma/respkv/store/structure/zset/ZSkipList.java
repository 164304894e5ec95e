package org.muma.respkv.store.structure.zset;

import org.muma.respkv.common.Bytes;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Redis style zskiplist: ordered by (score, member), every forward link carries the number of
 * nodes it skips so rank lookups are O(log N).
 */
public class ZSkipList {

    private static final int ZSKIPLIST_MAXLEVEL = 32;
    private static final double ZSKIPLIST_P = 0.25;

    private final ZSkipListNode header;
    private ZSkipListNode tail;
    private long length;
    private int level;

    public ZSkipList() {
        this.level = 1;
        this.length = 0;
        this.header = new ZSkipListNode(ZSKIPLIST_MAXLEVEL, 0, null);
    }

    private static boolean before(ZSkipListNode node, double score, Bytes member) {
        return node.score < score || (node.score == score && node.member.compareTo(member) < 0);
    }

    public ZSkipListNode insert(double score, Bytes member) {
        ZSkipListNode[] update = new ZSkipListNode[ZSKIPLIST_MAXLEVEL];
        long[] rank = new long[ZSKIPLIST_MAXLEVEL];

        ZSkipListNode x = this.header;
        for (int i = this.level - 1; i >= 0; i--) {
            rank[i] = (i == this.level - 1) ? 0 : rank[i + 1];
            while (x.level[i].forward != null && before(x.level[i].forward, score, member)) {
                rank[i] += x.level[i].span;
                x = x.level[i].forward;
            }
            update[i] = x;
        }

        int lvl = randomLevel();
        if (lvl > this.level) {
            for (int i = this.level; i < lvl; i++) {
                rank[i] = 0;
                update[i] = this.header;
                update[i].level[i].span = this.length;
            }
            this.level = lvl;
        }

        x = new ZSkipListNode(lvl, score, member);
        for (int i = 0; i < lvl; i++) {
            x.level[i].forward = update[i].level[i].forward;
            update[i].level[i].forward = x;

            x.level[i].span = update[i].level[i].span - (rank[0] - rank[i]);
            update[i].level[i].span = (rank[0] - rank[i]) + 1;
        }

        // levels above the new node now skip one more
        for (int i = lvl; i < this.level; i++) {
            update[i].level[i].span++;
        }

        x.backward = (update[0] == this.header) ? null : update[0];
        if (x.level[0].forward != null) {
            x.level[0].forward.backward = x;
        } else {
            this.tail = x;
        }

        this.length++;
        return x;
    }

    /**
     * @return 1 if the node was found and removed, 0 otherwise
     */
    public int delete(double score, Bytes member) {
        ZSkipListNode[] update = new ZSkipListNode[ZSKIPLIST_MAXLEVEL];
        ZSkipListNode x = this.header;

        for (int i = this.level - 1; i >= 0; i--) {
            while (x.level[i].forward != null && before(x.level[i].forward, score, member)) {
                x = x.level[i].forward;
            }
            update[i] = x;
        }

        x = x.level[0].forward;
        if (x != null && score == x.score && x.member.equals(member)) {
            deleteNode(x, update);
            return 1;
        }
        return 0;
    }

    private void deleteNode(ZSkipListNode x, ZSkipListNode[] update) {
        for (int i = 0; i < this.level; i++) {
            if (update[i].level[i].forward == x) {
                update[i].level[i].span += x.level[i].span - 1;
                update[i].level[i].forward = x.level[i].forward;
            } else {
                update[i].level[i].span -= 1;
            }
        }

        if (x.level[0].forward != null) {
            x.level[0].forward.backward = x.backward;
        } else {
            this.tail = x.backward;
        }

        while (this.level > 1 && this.header.level[this.level - 1].forward == null) {
            this.level--;
        }
        this.length--;
    }

    /**
     * Moves a member to a new score. Position depends on score, so this is delete + insert.
     */
    public ZSkipListNode updateScore(double curScore, Bytes member, double newScore) {
        if (delete(curScore, member) == 0) {
            throw new IllegalStateException("Node not found for update: " + member);
        }
        return insert(newScore, member);
    }

    /**
     * Node at the given 1-based rank, or {@code null}.
     */
    public ZSkipListNode getNodeByRank(long rank) {
        ZSkipListNode x = this.header;
        long traversed = 0;

        for (int i = this.level - 1; i >= 0; i--) {
            while (x.level[i].forward != null && (traversed + x.level[i].span) <= rank) {
                traversed += x.level[i].span;
                x = x.level[i].forward;
            }
            if (traversed == rank) {
                return x == header ? null : x;
            }
        }
        return null;
    }

    /**
     * 1-based rank of the member, 0 when absent.
     */
    public long getRank(double score, Bytes member) {
        long rank = 0;
        ZSkipListNode x = this.header;

        for (int i = this.level - 1; i >= 0; i--) {
            while (x.level[i].forward != null &&
                    (x.level[i].forward.score < score ||
                            (x.level[i].forward.score == score && x.level[i].forward.member.compareTo(member) <= 0))) {
                rank += x.level[i].span;
                x = x.level[i].forward;
            }
            if (x != header && x.member.equals(member)) {
                return rank;
            }
        }
        return 0;
    }

    /**
     * First node whose score falls inside the range, or {@code null}.
     */
    public ZSkipListNode firstInRange(RangeSpec range) {
        if (range.isEmpty() || tail == null || !range.gteMin(tail.score)) {
            return null;
        }
        ZSkipListNode x = this.header;
        for (int i = this.level - 1; i >= 0; i--) {
            while (x.level[i].forward != null && !range.gteMin(x.level[i].forward.score)) {
                x = x.level[i].forward;
            }
        }
        x = x.level[0].forward;
        return (x != null && range.lteMax(x.score)) ? x : null;
    }

    public ZSkipListNode first() {
        return header.level[0].forward;
    }

    private int randomLevel() {
        int lvl = 1;
        while ((ThreadLocalRandom.current().nextInt() & 0xFFFF) < (ZSKIPLIST_P * 0xFFFF)) {
            lvl += 1;
        }
        return Math.min(lvl, ZSKIPLIST_MAXLEVEL);
    }

    public long length() {
        return length;
    }
}
