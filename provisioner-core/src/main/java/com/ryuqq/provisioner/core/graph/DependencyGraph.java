package com.ryuqq.provisioner.core.graph;

import com.ryuqq.provisioner.core.error.DependencyCycleException;
import com.ryuqq.provisioner.core.error.DuplicateAddressException;
import com.ryuqq.provisioner.core.error.UnresolvedReferenceException;
import com.ryuqq.provisioner.core.model.Address;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * 리소스 간 의존성 DAG와 결정적 위상 정렬.
 *
 * <p><strong>구성 규칙:</strong></p>
 * <ul>
 *   <li>노드 집합 밖의 주소를 가리키는 간선은 외부 주소(예: State에만 있는 주소)이면 제거,
 *       아니면 {@link UnresolvedReferenceException}</li>
 *   <li>순환이 있으면 {@link DependencyCycleException} (경로는 첫 노드로 닫힘, 예: [a, b, a])</li>
 * </ul>
 *
 * <p><strong>정렬 규칙 (Kahn):</strong></p>
 * <ul>
 *   <li>준비된 노드 중 (priority 오름차순, 선언 순서 오름차순)으로 선택</li>
 *   <li>의존성과 우선순위가 충돌하면 의존성이 우선
 *       (priority 0 노드가 priority 100 노드에 의존하면 그 뒤에 정렬)</li>
 * </ul>
 *
 * <p><strong>순수성:</strong> 생성 시 정렬이 한 번 계산되며 이후 불변입니다.</p>
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
public final class DependencyGraph {

    private static final Comparator<GraphNode> READY_ORDER =
        Comparator.comparingInt(GraphNode::priority).thenComparingInt(GraphNode::index);

    private final Map<Address, GraphNode> nodes;
    private final Map<Address, Set<Address>> edges;
    private final List<Address> order;

    private DependencyGraph(Map<Address, GraphNode> nodes, Map<Address, Set<Address>> edges) {
        this.nodes = Collections.unmodifiableMap(nodes);
        this.edges = Collections.unmodifiableMap(edges);
        detectCycle();
        this.order = Collections.unmodifiableList(linearize());
    }

    /**
     * 그래프 생성.
     *
     * @param nodes 노드 목록 (선언 순서)
     * @param externalAddresses 노드가 아니지만 참조 가능한 주소 (해당 간선은 제거)
     * @return DependencyGraph
     * @throws DuplicateAddressException 주소가 중복된 경우
     * @throws UnresolvedReferenceException 알 수 없는 주소를 참조하는 경우
     * @throws DependencyCycleException 순환이 있는 경우
     */
    public static DependencyGraph build(List<GraphNode> nodes, Set<Address> externalAddresses) {
        Set<Address> external = externalAddresses == null ? Collections.emptySet() : externalAddresses;
        return build(nodes, external::contains);
    }

    /**
     * 노드 밖을 가리키는 간선을 모두 제거하며 그래프 생성.
     *
     * <p>State에 기록된 의존성으로 DELETE 순서를 계산할 때 사용합니다.</p>
     *
     * @param nodes 노드 목록
     * @return DependencyGraph
     * @throws DependencyCycleException 순환이 있는 경우
     */
    public static DependencyGraph lenient(List<GraphNode> nodes) {
        return build(nodes, address -> true);
    }

    private static DependencyGraph build(List<GraphNode> nodeList, Predicate<Address> droppable) {
        if (nodeList == null) {
            throw new IllegalArgumentException("nodes cannot be null");
        }
        Map<Address, GraphNode> byAddress = new LinkedHashMap<>();
        for (GraphNode node : nodeList) {
            if (byAddress.putIfAbsent(node.address(), node) != null) {
                throw new DuplicateAddressException(node.address());
            }
        }
        Map<Address, Set<Address>> edges = new HashMap<>();
        for (GraphNode node : byAddress.values()) {
            Set<Address> resolved = new TreeSet<>();
            for (Address dependency : node.dependencies()) {
                if (byAddress.containsKey(dependency)) {
                    resolved.add(dependency);
                } else if (!droppable.test(dependency)) {
                    throw new UnresolvedReferenceException(node.address(), dependency);
                }
            }
            edges.put(node.address(), Collections.unmodifiableSet(resolved));
        }
        return new DependencyGraph(byAddress, edges);
    }

    /**
     * 위상 정렬 순서 (의존 대상이 먼저).
     *
     * @return 주소 목록
     */
    public List<Address> topologicalOrder() {
        return order;
    }

    /**
     * 역 위상 정렬 순서 (의존하는 쪽이 먼저).
     *
     * @return 주소 목록
     */
    public List<Address> reverseTopologicalOrder() {
        List<Address> reversed = new ArrayList<>(order);
        Collections.reverse(reversed);
        return Collections.unmodifiableList(reversed);
    }

    /**
     * 노드 안에서 해석된 의존 주소 조회.
     *
     * @param address 주소
     * @return 의존 주소 집합 (노드가 아니면 빈 집합)
     */
    public Set<Address> dependenciesOf(Address address) {
        return edges.getOrDefault(address, Collections.emptySet());
    }

    /**
     * 주소가 노드인지 확인.
     *
     * @param address 주소
     * @return 노드이면 true
     */
    public boolean contains(Address address) {
        return nodes.containsKey(address);
    }

    /**
     * 노드 개수.
     *
     * @return 노드 개수
     */
    public int size() {
        return nodes.size();
    }

    /**
     * 전체 노드 (선언 순서).
     *
     * @return 노드 목록
     */
    public Collection<GraphNode> nodes() {
        return nodes.values();
    }

    private void detectCycle() {
        Set<Address> visited = new HashSet<>();
        Deque<Address> stack = new ArrayDeque<>();
        Set<Address> onStack = new HashSet<>();
        for (Address start : nodes.keySet()) {
            if (!visited.contains(start)) {
                visit(start, visited, stack, onStack);
            }
        }
    }

    private void visit(Address current, Set<Address> visited, Deque<Address> stack, Set<Address> onStack) {
        visited.add(current);
        stack.addLast(current);
        onStack.add(current);
        for (Address next : edges.get(current)) {
            if (onStack.contains(next)) {
                throw new DependencyCycleException(cyclePath(stack, next));
            }
            if (!visited.contains(next)) {
                visit(next, visited, stack, onStack);
            }
        }
        stack.removeLast();
        onStack.remove(current);
    }

    private static List<Address> cyclePath(Deque<Address> stack, Address repeated) {
        List<Address> path = new ArrayList<>();
        boolean inCycle = false;
        for (Address address : stack) {
            if (address.equals(repeated)) {
                inCycle = true;
            }
            if (inCycle) {
                path.add(address);
            }
        }
        path.add(repeated);
        return path;
    }

    private List<Address> linearize() {
        Map<Address, Integer> inDegree = new HashMap<>();
        Map<Address, List<Address>> dependents = new HashMap<>();
        for (Address address : nodes.keySet()) {
            inDegree.put(address, edges.get(address).size());
            for (Address dependency : edges.get(address)) {
                dependents.computeIfAbsent(dependency, key -> new ArrayList<>()).add(address);
            }
        }

        PriorityQueue<GraphNode> ready = new PriorityQueue<>(READY_ORDER);
        for (GraphNode node : nodes.values()) {
            if (inDegree.get(node.address()) == 0) {
                ready.add(node);
            }
        }

        List<Address> result = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            GraphNode node = ready.poll();
            result.add(node.address());
            for (Address dependent : dependents.getOrDefault(node.address(), Collections.emptyList())) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(nodes.get(dependent));
                }
            }
        }

        if (result.size() != nodes.size()) {
            // detectCycle()가 먼저 실행되므로 도달하지 않음
            throw new IllegalStateException("Graph linearization did not visit every node");
        }
        return result;
    }
}
