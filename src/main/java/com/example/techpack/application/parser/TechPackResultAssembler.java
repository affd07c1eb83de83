package com.example.techpack.application.parser;

import com.example.techpack.domain.model.BaseInformation;
import com.example.techpack.domain.model.ComponentTables;
import com.example.techpack.domain.model.GarmentComponent;
import com.example.techpack.domain.model.Section;
import com.example.techpack.domain.model.TechPackAnalysis;
import com.example.techpack.domain.model.TechPackItem;
import com.example.techpack.domain.model.TechnicalTable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Final merge step: removes duplicate items per section, orders components canonically and
 * drops components without rows.
 */
@Component
public class TechPackResultAssembler {

    /**
     * @param sectionItems    items per section, may miss sections
     * @param componentTables tables per component, in any order
     * @param baseInformation header facts, or {@code null}
     * @return envelope with every section present
     */
    public TechPackAnalysis assemble(Map<Section, List<TechPackItem>> sectionItems,
                                     Map<GarmentComponent, ComponentTables> componentTables,
                                     BaseInformation baseInformation) {
        Map<Section, List<TechPackItem>> sections = new EnumMap<>(Section.class);
        for (Section section : Section.values()) {
            List<TechPackItem> items = sectionItems == null ? null : sectionItems.get(section);
            sections.put(section, deduplicate(items));
        }
        return new TechPackAnalysis(sections, orderComponents(componentTables), baseInformation);
    }

    private List<TechPackItem> deduplicate(List<TechPackItem> items) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        Set<String> seen = new HashSet<>();
        List<TechPackItem> unique = new ArrayList<>(items.size());
        for (TechPackItem item : items) {
            if (item != null && seen.add(item.dedupKey())) {
                unique.add(item);
            }
        }
        return unique;
    }

    private TechnicalTable orderComponents(Map<GarmentComponent, ComponentTables> componentTables) {
        if (componentTables == null || componentTables.isEmpty()) {
            return TechnicalTable.empty();
        }
        List<ComponentTables> ordered = new ArrayList<>();
        for (GarmentComponent component : GarmentComponent.values()) {
            ComponentTables tables = componentTables.get(component);
            if (tables != null && !tables.isEmpty()) {
                ordered.add(tables);
            }
        }
        return new TechnicalTable(List.copyOf(ordered));
    }
}
