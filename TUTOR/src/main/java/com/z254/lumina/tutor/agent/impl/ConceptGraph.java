package com.z254.lumina.tutor.agent.impl;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Prerequisite graph of the organic chemistry curriculum.
 */
@Component
public class ConceptGraph {

    public record ConceptNode(String concept, List<String> prerequisites, List<String> nextConcepts,
                              int difficulty, int estimatedMinutes) {
    }

    private final Map<String, ConceptNode> nodes = Map.ofEntries(
            node("atomic structure", List.of(), List.of("chemical bonding"), 1, 20),
            node("chemical bonding", List.of("atomic structure"), List.of("hybridization", "resonance"), 2, 30),
            node("hybridization", List.of("chemical bonding"), List.of("alkanes", "alkenes"), 3, 30),
            node("resonance", List.of("chemical bonding"), List.of("aromatic"), 3, 30),
            node("alkanes", List.of("hybridization"), List.of("alkenes", "stereochemistry"), 2, 25),
            node("alkenes", List.of("alkanes"), List.of("addition", "alkynes"), 3, 30),
            node("alkynes", List.of("alkenes"), List.of("synthesis"), 3, 30),
            node("aromatic", List.of("resonance", "alkenes"), List.of("synthesis"), 4, 40),
            node("stereochemistry", List.of("alkanes"), List.of("sn1", "sn2"), 4, 45),
            node("nucleophile", List.of("chemical bonding"), List.of("sn1", "sn2"), 3, 25),
            node("sn1", List.of("stereochemistry", "nucleophile"), List.of("elimination"), 4, 40),
            node("sn2", List.of("stereochemistry", "nucleophile"), List.of("elimination", "sn1"), 4, 40),
            node("substitution", List.of("nucleophile", "stereochemistry"), List.of("elimination"), 4, 40),
            node("elimination", List.of("substitution"), List.of("synthesis"), 4, 40),
            node("addition", List.of("alkenes"), List.of("synthesis"), 3, 35),
            node("oxidation", List.of("chemical bonding"), List.of("synthesis"), 3, 30),
            node("reduction", List.of("chemical bonding"), List.of("synthesis"), 3, 30),
            node("spectroscopy", List.of("chemical bonding"), List.of("synthesis"), 4, 45),
            node("synthesis", List.of("substitution", "elimination", "addition"), List.of("biomolecules"), 5, 60),
            node("biomolecules", List.of("synthesis"), List.of(), 5, 60));

    public Optional<ConceptNode> find(String concept) {
        return Optional.ofNullable(concept).map(c -> nodes.get(c.toLowerCase(Locale.ROOT).trim()));
    }

    public List<String> getPrerequisites(String concept) {
        return find(concept).map(ConceptNode::prerequisites).orElse(List.of());
    }

    public List<String> getNextConcepts(String concept) {
        return find(concept).map(ConceptNode::nextConcepts).orElse(List.of());
    }

    public int getDifficulty(String concept) {
        return find(concept).map(ConceptNode::difficulty).orElse(3);
    }

    public int getEstimatedMinutes(String concept) {
        return find(concept).map(ConceptNode::estimatedMinutes).orElse(30);
    }

    public Set<String> getConcepts() {
        return nodes.keySet();
    }

    /**
     * Concepts in study order: unmet prerequisites first (depth-first), then the targets.
     * Concepts in {@code known} are skipped.
     */
    public List<String> studyOrder(List<String> targets, Set<String> known) {
        Set<String> ordered = new LinkedHashSet<>();
        for (String target : targets) {
            visit(target.toLowerCase(Locale.ROOT).trim(), known, ordered, new LinkedHashSet<>());
        }
        return new ArrayList<>(ordered);
    }

    private void visit(String concept, Set<String> known, Set<String> ordered, Set<String> path) {
        if (ordered.contains(concept) || known.contains(concept) || !path.add(concept)) {
            return;
        }
        for (String prerequisite : getPrerequisites(concept)) {
            visit(prerequisite, known, ordered, path);
        }
        ordered.add(concept);
    }

    private static Map.Entry<String, ConceptNode> node(String concept, List<String> prerequisites,
                                                       List<String> next, int difficulty, int minutes) {
        return Map.entry(concept, new ConceptNode(concept, prerequisites, next, difficulty, minutes));
    }
}
