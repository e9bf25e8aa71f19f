package com.eli5y.infrastructure.alignment;

import com.eli5y.domain.formula.model.ResolvedComponent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives direct parent/child edges between located components from their markup ranges.
 * <p>
 * Containment cycles between multi-range components are broken by input order, so the relation
 * forms a DAG over components; the result is its transitive reduction, so a component is listed
 * only under the innermost components that contain it.
 * </p>
 */
@Slf4j
@Component
public class HierarchyBuilder {

    /**
     * Compute the direct children of every component.
     *
     * @param components located components in normalized order
     * @return for each component (same order), the ascending indices of its direct children
     */
    public List<List<Integer>> buildChildren(List<ResolvedComponent> components) {
        boolean[][] contains = containmentEdges(components);
        int n = components.size();

        List<List<Integer>> children = new ArrayList<>(n);
        for (int parent = 0; parent < n; parent++) {
            List<Integer> direct = new ArrayList<>();
            for (int child = 0; child < n; child++) {
                if (contains[parent][child] && !hasIntermediate(contains, parent, child)) {
                    direct.add(child);
                }
            }
            children.add(List.copyOf(direct));
        }

        log.debug("[Hierarchy] children per component: {}", children);
        return children;
    }

    /**
     * {@code edges[i][j]} is true if some range of j is strictly inside some range of i.
     * Multi-range components can contain each other, pairwise or around a longer cycle. An edge
     * pointing back to an earlier component is dropped whenever that component already reaches
     * the later one, so every cycle is broken by input order and the result is acyclic.
     */
    boolean[][] containmentEdges(List<ResolvedComponent> components) {
        int n = components.size();
        boolean[][] raw = new boolean[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                raw[i][j] = i != j && components.get(i).contains(components.get(j));
            }
        }

        boolean[][] reaches = transitiveClosure(raw);
        boolean[][] edges = new boolean[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                edges[i][j] = raw[i][j] && !(j < i && reaches[j][i]);
            }
        }
        return edges;
    }

    private static boolean[][] transitiveClosure(boolean[][] raw) {
        int n = raw.length;
        boolean[][] reaches = new boolean[n][];
        for (int i = 0; i < n; i++) {
            reaches[i] = raw[i].clone();
        }
        for (int k = 0; k < n; k++) {
            for (int i = 0; i < n; i++) {
                if (!reaches[i][k]) {
                    continue;
                }
                for (int j = 0; j < n; j++) {
                    reaches[i][j] |= reaches[k][j];
                }
            }
        }
        return reaches;
    }

    // Another candidate under parent that itself contains child makes child a grandchild
    private boolean hasIntermediate(boolean[][] contains, int parent, int child) {
        for (int middle = 0; middle < contains.length; middle++) {
            if (middle != child && middle != parent
                    && contains[parent][middle] && contains[middle][child]) {
                return true;
            }
        }
        return false;
    }
}
