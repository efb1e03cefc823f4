package com.wangbin.exporter.core.dispatch;

import com.wangbin.exporter.common.domain.enums.MatchMode;
import com.wangbin.exporter.core.gnmi.model.PathElement;
import com.wangbin.exporter.core.gnmi.model.SchemaPath;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 路径前缀路由表，按路径元素名组织成前缀树，会话启动时构建一次。
 * 列表键约束在命中节点上再逐条校验。
 *
 * @param <T> 路由目标
 */
public class DispatchTable<T> {

    private final Node<T> root = new Node<>();
    private int size = 0;

    public void register(SchemaPath prefix, MatchMode match, T target) {
        Node<T> node = root;
        for (PathElement element : prefix.elements()) {
            node = node.children.computeIfAbsent(element.name(), name -> new Node<>());
        }
        node.routes.add(new Route<>(prefix, match, target));
        size++;
    }

    /**
     * 更新路由：返回订阅路径匹配该路径的目标，按注册顺序去重。
     * 名称为 {@code *} 的订阅元素匹配该层任意元素。
     */
    public List<T> route(SchemaPath path) {
        Set<T> targets = new LinkedHashSet<>();
        descendMatching(root, path, 0, targets);
        return new ArrayList<>(targets);
    }

    /**
     * 删除路由：删除路径可能是订阅路径的上级，也可能在其之下，只要两者重叠即投递
     */
    public List<T> routeOverlapping(SchemaPath path) {
        Set<T> targets = new LinkedHashSet<>();
        descendOverlapping(root, path, 0, targets);
        return new ArrayList<>(targets);
    }

    public int size() {
        return size;
    }

    private void descendMatching(Node<T> node, SchemaPath path, int depth, Set<T> targets) {
        collectMatching(node, path, targets);
        if (depth == path.size()) {
            return;
        }
        for (Node<T> child : node.next(path.get(depth))) {
            descendMatching(child, path, depth + 1, targets);
        }
    }

    private void descendOverlapping(Node<T> node, SchemaPath path, int depth, Set<T> targets) {
        if (depth == path.size()) {
            collectSubtree(node, path, targets);
            return;
        }
        collectOverlapping(node, path, targets);
        PathElement element = path.get(depth);
        Iterable<Node<T>> children = element.isWildcard() ? node.children.values() : node.next(element);
        for (Node<T> child : children) {
            descendOverlapping(child, path, depth + 1, targets);
        }
    }

    private void collectMatching(Node<T> node, SchemaPath path, Set<T> targets) {
        for (Route<T> route : node.routes) {
            boolean matched = route.match() == MatchMode.EXACT
                    ? path.matchesExactly(route.prefix())
                    : path.startsWith(route.prefix());
            if (matched) {
                targets.add(route.target());
            }
        }
    }

    private void collectOverlapping(Node<T> node, SchemaPath path, Set<T> targets) {
        for (Route<T> route : node.routes) {
            if (route.prefix().overlaps(path)) {
                targets.add(route.target());
            }
        }
    }

    private void collectSubtree(Node<T> node, SchemaPath path, Set<T> targets) {
        collectOverlapping(node, path, targets);
        for (Node<T> child : node.children.values()) {
            collectSubtree(child, path, targets);
        }
    }

    private static final class Node<T> {
        private final Map<String, Node<T>> children = new HashMap<>();
        private final List<Route<T>> routes = new ArrayList<>(1);

        private List<Node<T>> next(PathElement element) {
            Node<T> exact = children.get(element.name());
            Node<T> wildcard = element.isWildcard() ? null : children.get(PathElement.WILDCARD);
            if (wildcard == null) {
                return exact == null ? List.of() : List.of(exact);
            }
            return exact == null ? List.of(wildcard) : List.of(exact, wildcard);
        }
    }

    private record Route<T>(SchemaPath prefix, MatchMode match, T target) {
    }
}
