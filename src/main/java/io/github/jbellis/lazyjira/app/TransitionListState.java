package io.github.jbellis.lazyjira.app;

import io.github.jbellis.lazyjira.model.Transition;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class TransitionListState {
    private final List<Transition> transitions = new ArrayList<>();
    private int focusedIndex = -1;

    public void setTransitions(List<Transition> newTransitions) {
        transitions.clear();
        transitions.addAll(newTransitions);
        focusedIndex = transitions.isEmpty() ? -1 : 0;
    }

    public void clear() {
        setTransitions(List.of());
    }

    public void moveUp() {
        if (focusedIndex > 0) {
            focusedIndex--;
        }
    }

    public void moveDown() {
        if (focusedIndex >= 0 && focusedIndex < transitions.size() - 1) {
            focusedIndex++;
        }
    }

    public Optional<Transition> focusedTransition() {
        return focusedIndex >= 0 ? Optional.of(transitions.get(focusedIndex)) : Optional.empty();
    }

    public List<Transition> transitions() {
        return List.copyOf(transitions);
    }

    public int focusedIndex() {
        return focusedIndex;
    }

    public boolean isEmpty() {
        return transitions.isEmpty();
    }
}
