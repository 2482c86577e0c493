package org.stocktake.exception;

import org.stocktake.domain.AreaItem;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 存在尚未盘点也未跳过的条目，不能完成会话
 */
public class IncompleteDecisionsException extends StockSessionException {

    private final List<String> unresolvedItemIds;
    private final List<String> unresolvedItemNames;

    public IncompleteDecisionsException(List<AreaItem> unresolved) {
        super("INCOMPLETE_DECISIONS", "以下条目尚未盘点或跳过："
                + unresolved.stream().map(AreaItem::getName).collect(Collectors.joining("、")));
        this.unresolvedItemIds = unresolved.stream().map(AreaItem::getId).toList();
        this.unresolvedItemNames = unresolved.stream().map(AreaItem::getName).toList();
    }

    public List<String> getUnresolvedItemIds() {
        return unresolvedItemIds;
    }

    public List<String> getUnresolvedItemNames() {
        return unresolvedItemNames;
    }
}
