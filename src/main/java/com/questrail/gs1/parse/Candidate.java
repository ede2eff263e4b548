package com.questrail.gs1.parse;

import com.questrail.gs1.api.ParsedElement;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One partial or complete interpretation of the input.
 *
 * <p>The beam parser accumulates an additive {@code score}; the ambiguity
 * solver uses it as a multiplicative confidence. Candidates are immutable:
 * every step returns a new instance.</p>
 *
 * @param elements  elements chosen so far, in input order
 * @param score     cumulative score
 * @param position  next unread offset in the normalized input
 * @param reasoning trail of scoring notes
 */
public record Candidate(List<ParsedElement> elements, double score, int position, List<String> reasoning)
{
    public Candidate {
        elements = List.copyOf(Objects.requireNonNull(elements, "elements"));
        reasoning = List.copyOf(Objects.requireNonNull(reasoning, "reasoning"));
    }

    public static Candidate start(double score) {
        return new Candidate(List.of(), score, 0, List.of());
    }

    /**
     * Appends {@code element} and moves to {@code newPosition}; the score is
     * unchanged.
     */
    public Candidate append(ParsedElement element, int newPosition) {
        List<ParsedElement> next = new ArrayList<>(elements.size() + 1);
        next.addAll(elements);
        next.add(element);
        return new Candidate(next, score, newPosition, reasoning);
    }

    /**
     * Puts {@code element} in front of this candidate's elements and scales
     * the score by {@code factor}.
     */
    public Candidate prepend(ParsedElement element, double factor, int newPosition, String note) {
        List<ParsedElement> next = new ArrayList<>(elements.size() + 1);
        next.add(element);
        next.addAll(elements);
        List<String> notes = reasoning;
        if (note != null) {
            notes = new ArrayList<>(reasoning.size() + 1);
            notes.add(note);
            notes.addAll(reasoning);
        }
        return new Candidate(next, score * factor, newPosition, notes);
    }

    public Candidate adjust(double delta, String note) {
        List<String> notes = new ArrayList<>(reasoning.size() + 1);
        notes.addAll(reasoning);
        notes.add(note);
        return new Candidate(elements, score + delta, position, notes);
    }

    public Candidate withScore(double newScore, int newPosition) {
        return new Candidate(elements, newScore, newPosition, reasoning);
    }

    public List<String> aiOrder() {
        return elements.stream().map(ParsedElement::ai).toList();
    }

    public long count(String ai) {
        return elements.stream().filter(e -> e.ai().equals(ai)).count();
    }

    public boolean contains(String ai) {
        return elements.stream().anyMatch(e -> e.ai().equals(ai));
    }

    public int validCount() {
        return (int) elements.stream().filter(ParsedElement::valid).count();
    }
}
