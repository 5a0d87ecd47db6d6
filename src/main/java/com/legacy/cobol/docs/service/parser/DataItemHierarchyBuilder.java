package com.legacy.cobol.docs.service.parser;

import com.legacy.cobol.docs.dto.parser.DataDivision;
import com.legacy.cobol.docs.dto.parser.DataItem;
import com.legacy.cobol.docs.dto.parser.ParsedProgram;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Rebuilds the group structure of a flat, line-ordered data item list.
 *
 * <ul>
 *   <li>levels 01-49 nest under the closest preceding item with a lower level</li>
 *   <li>88 condition names attach to the item right before them</li>
 *   <li>66 and 77 items always stay at the top level</li>
 * </ul>
 * Level numbers are not validated; an item whose level fits nowhere becomes a root.
 */
@Component
public class DataItemHierarchyBuilder {

    private static final int CONDITION_NAME = 88;
    private static final int RENAMES = 66;
    private static final int INDEPENDENT = 77;

    /**
     * Copy of {@code program} whose DATA DIVISION sections and file records are nested.
     */
    public ParsedProgram nest(ParsedProgram program) {
        if (program.getDivisions() == null || program.getDivisions().getData() == null) {
            return program;
        }
        DataDivision data = program.getDivisions().getData();
        DataDivision nested = data.toBuilder()
                .fileSection(data.getFileSection().stream()
                        .map(fd -> fd.toBuilder().records(nest(fd.getRecords())).build())
                        .toList())
                .workingStorageSection(nest(data.getWorkingStorageSection()))
                .localStorageSection(nest(data.getLocalStorageSection()))
                .linkageSection(nest(data.getLinkageSection()))
                .build();
        return program.toBuilder()
                .divisions(program.getDivisions().toBuilder().data(nested).build())
                .build();
    }

    public List<DataItem> nest(List<DataItem> flat) {
        List<Node> roots = new ArrayList<>();
        Deque<Node> open = new ArrayDeque<>();
        Node previous = null;

        for (DataItem item : flat) {
            Node node = new Node(item);
            int level = item.getLevel();

            if (level == CONDITION_NAME) {
                if (previous != null) {
                    previous.children.add(node);
                } else {
                    roots.add(node);
                }
                continue;
            }

            if (level == RENAMES || level == INDEPENDENT) {
                open.clear();
                roots.add(node);
                if (level == INDEPENDENT) {
                    open.push(node);
                }
                previous = node;
                continue;
            }

            while (!open.isEmpty() && (open.peek().level() >= level || open.peek().level() == INDEPENDENT)) {
                open.pop();
            }
            if (open.isEmpty()) {
                roots.add(node);
            } else {
                open.peek().children.add(node);
            }
            open.push(node);
            previous = node;
        }

        return roots.stream().map(Node::toDataItem).toList();
    }

    private static final class Node {
        private final DataItem item;
        private final List<Node> children = new ArrayList<>();

        private Node(DataItem item) {
            this.item = item;
        }

        private int level() {
            return item.getLevel();
        }

        private DataItem toDataItem() {
            return item.toBuilder()
                    .children(children.stream().map(Node::toDataItem).toList())
                    .build();
        }
    }
}
