package org.muma.respkv.store.structure.zset;

import org.muma.respkv.common.Bytes;

/**
 * Skip list node, mirrors Redis' zskiplistNode.
 */
public class ZSkipListNode {

    public final Bytes member;
    public final double score;

    public ZSkipListNode backward;
    public final ZSkipListLevel[] level;

    public ZSkipListNode(int level, double score, Bytes member) {
        this.score = score;
        this.member = member;
        this.level = new ZSkipListLevel[level];
        for (int i = 0; i < level; i++) {
            this.level[i] = new ZSkipListLevel();
        }
    }

    public static class ZSkipListLevel {
        public ZSkipListNode forward;
        public long span; // nodes skipped when following forward
    }

    @Override
    public String toString() {
        return "Node{score=" + score + ", member='" + member + "'}";
    }
}
