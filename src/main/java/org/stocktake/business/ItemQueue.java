package org.stocktake.business;

import org.stocktake.domain.AreaItem;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 当前区域的有序条目队列
 *
 * 条目存放在固定槽位（arena）中，顺序由 prev/next 双向链表单独维护：
 * - next/previous 只移动游标，O(1)
 * - skip 把当前条目摘下挂到队尾，O(1)，游标下标不变（现在指向原来的下一个条目）
 * - 每个条目的跳过次数单调递增，不阻塞任何操作
 *
 * 非线程安全，由 StockSessionEngine 串行访问。
 */
public class ItemQueue {

    private static final int NONE = -1;

    // 跳过次数达到该值时提示"已跳过两次"
    private static final int REPEATED_SKIP_THRESHOLD = 2;

    private final List<AreaItem> arena;
    private final Map<String, Integer> slotById;
    private final int[] prev;
    private final int[] next;
    private final int[] skipCounts;

    private int head = NONE;
    private int tail = NONE;
    private int cursorSlot = NONE;
    private int cursor;

    public ItemQueue(List<AreaItem> items) {
        int size = items.size();
        this.arena = new ArrayList<>(items);
        this.slotById = new HashMap<>(size * 2);
        this.prev = new int[size];
        this.next = new int[size];
        this.skipCounts = new int[size];
        Arrays.fill(prev, NONE);
        Arrays.fill(next, NONE);

        for (int slot = 0; slot < size; slot++) {
            AreaItem item = arena.get(slot);
            if (slotById.put(item.getId(), slot) != null) {
                throw new IllegalArgumentException("重复的条目ID: " + item.getId());
            }
            append(slot);
        }
        this.cursorSlot = head;
        this.cursor = 0;
    }

    /**
     * 从快照恢复：顺序、跳过次数、游标完全一致
     */
    public static ItemQueue restore(QueueSnapshot snapshot) {
        ItemQueue queue = new ItemQueue(snapshot.getItems());
        Map<String, Integer> counts = snapshot.getSkipCounts();
        if (counts != null) {
            counts.forEach((itemId, count) -> {
                Integer slot = queue.slotById.get(itemId);
                if (slot != null) {
                    queue.skipCounts[slot] = count;
                }
            });
        }
        queue.goTo(Math.max(0, Math.min(snapshot.getCursor(), queue.size() - 1)));
        return queue;
    }

    public QueueSnapshot snapshot() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (int slot = head; slot != NONE; slot = next[slot]) {
            if (skipCounts[slot] > 0) {
                counts.put(arena.get(slot).getId(), skipCounts[slot]);
            }
        }
        return new QueueSnapshot(items(), counts, cursor);
    }

    public int size() {
        return arena.size();
    }

    public boolean isEmpty() {
        return arena.isEmpty();
    }

    public int cursor() {
        return cursor;
    }

    /**
     * 当前条目，队列为空时返回 null
     */
    public AreaItem current() {
        return cursorSlot == NONE ? null : arena.get(cursorSlot);
    }

    public boolean isLast() {
        return cursorSlot == tail;
    }

    /**
     * 前进一个条目；已是最后一个时不动
     *
     * @return 游标是否移动
     */
    public boolean next() {
        if (cursorSlot == NONE || cursorSlot == tail) {
            return false;
        }
        cursorSlot = next[cursorSlot];
        cursor++;
        return true;
    }

    /**
     * 后退一个条目
     *
     * @return false 表示已经在第一个条目
     */
    public boolean previous() {
        if (cursorSlot == NONE || cursor == 0) {
            return false;
        }
        cursorSlot = prev[cursorSlot];
        cursor--;
        return true;
    }

    /**
     * 跳到指定下标，越界时不动
     */
    public boolean goTo(int index) {
        if (index < 0 || index >= size()) {
            return false;
        }
        int slot = head;
        for (int i = 0; i < index; i++) {
            slot = next[slot];
        }
        cursorSlot = slot;
        cursor = index;
        return true;
    }

    /**
     * 跳过当前条目：移到队尾，跳过次数+1，游标下标不变
     *
     * @param itemId 必须是当前条目
     * @return 该条目最新的跳过次数
     */
    public int skip(String itemId) {
        AreaItem current = current();
        if (current == null || !current.getId().equals(itemId)) {
            throw new IllegalArgumentException("只能跳过当前条目，itemId=" + itemId);
        }
        int slot = cursorSlot;
        skipCounts[slot]++;
        if (slot != tail) {
            int successor = next[slot];
            unlink(slot);
            append(slot);
            cursorSlot = successor;
        }
        return skipCounts[slot];
    }

    public int skipCount(String itemId) {
        Integer slot = slotById.get(itemId);
        return slot == null ? 0 : skipCounts[slot];
    }

    /**
     * "已跳过两次"提示
     */
    public boolean isRepeatedlySkipped(String itemId) {
        return skipCount(itemId) >= REPEATED_SKIP_THRESHOLD;
    }

    public AreaItem find(String itemId) {
        Integer slot = slotById.get(itemId);
        return slot == null ? null : arena.get(slot);
    }

    /**
     * 当前顺序的条目ID
     */
    public List<String> order() {
        List<String> ids = new ArrayList<>(size());
        for (int slot = head; slot != NONE; slot = next[slot]) {
            ids.add(arena.get(slot).getId());
        }
        return ids;
    }

    /**
     * 当前顺序的条目
     */
    public List<AreaItem> items() {
        List<AreaItem> ordered = new ArrayList<>(size());
        for (int slot = head; slot != NONE; slot = next[slot]) {
            ordered.add(arena.get(slot));
        }
        return ordered;
    }

    private void unlink(int slot) {
        int p = prev[slot];
        int n = next[slot];
        if (p != NONE) {
            next[p] = n;
        } else {
            head = n;
        }
        if (n != NONE) {
            prev[n] = p;
        } else {
            tail = p;
        }
        prev[slot] = NONE;
        next[slot] = NONE;
    }

    private void append(int slot) {
        prev[slot] = tail;
        next[slot] = NONE;
        if (tail != NONE) {
            next[tail] = slot;
        } else {
            head = slot;
        }
        tail = slot;
    }
}
