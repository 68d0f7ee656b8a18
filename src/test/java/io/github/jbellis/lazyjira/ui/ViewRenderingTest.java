package io.github.jbellis.lazyjira.ui;

import static io.github.jbellis.lazyjira.testutil.TestIssues.comment;
import static io.github.jbellis.lazyjira.testutil.TestIssues.issue;
import static org.junit.jupiter.api.Assertions.*;

import io.github.jbellis.lazyjira.app.AppController;
import io.github.jbellis.lazyjira.app.AppEvent;
import io.github.jbellis.lazyjira.app.AppState;
import io.github.jbellis.lazyjira.exception.LazyJiraException;
import io.github.jbellis.lazyjira.model.Transition;
import io.github.jbellis.lazyjira.testutil.FakeJiraClient;
import java.util.List;
import java.util.stream.Collectors;
import org.jline.utils.AttributedString;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Drives state through the controller, then checks the plain text each view produces. */
class ViewRenderingTest {
    private static final int WIDTH = 100;

    private FakeJiraClient client;
    private AppState state;
    private AppController controller;

    @BeforeEach
    void setUp() {
        client = new FakeJiraClient()
                .withIssues(
                        issue("PROJ-1", "First"),
                        issue("PROJ-2", "Second"),
                        issue("PROJ-3", "Third"),
                        issue("PROJ-4", "Fourth"),
                        issue("PROJ-5", "Fifth"))
                .withComments("PROJ-1", comment("c1", "Looks good"))
                .withTransitions("PROJ-1", new Transition("11", "Start Progress", "In Progress"));
        state = new AppState("example.atlassian.net");
        controller = new AppController(client, state, "project = PROJ", 50, uri -> {}, () -> {});
    }

    @AfterEach
    void tearDown() {
        controller.close();
    }

    private static List<String> text(List<AttributedString> lines) {
        return lines.stream().map(AttributedString::toString).collect(Collectors.toList());
    }

    @Test
    void emptyListShowsHint() {
        client.setIssues(List.of());
        controller.loadInitial();

        var lines = text(TicketListView.render(state, WIDTH, 10));

        assertEquals(List.of("Tickets (0)", "No tickets found. Press r to refresh."), lines);
    }

    @Test
    void listRowsShowKeyStatusAndSummary() {
        controller.loadInitial();
        controller.handle(AppEvent.TOGGLE_SELECTION);

        var lines = text(TicketListView.render(state, WIDTH, 10));

        assertEquals("Tickets (5)", lines.get(0));
        assertEquals(6, lines.size());
        assertTrue(lines.get(1).startsWith("✓ PROJ-1"));
        assertTrue(lines.get(1).contains("[To Do]"));
        assertTrue(lines.get(1).contains("First"));
        assertTrue(lines.get(2).startsWith("  PROJ-2"));
    }

    @Test
    void listScrollsToKeepFocusVisible() {
        controller.loadInitial();
        for (int i = 0; i < 4; i++) {
            controller.handle(AppEvent.MOVE_DOWN);
        }

        var lines = text(TicketListView.render(state, WIDTH, 3));

        assertEquals(3, lines.size());
        assertTrue(lines.get(1).contains("PROJ-4"));
        assertTrue(lines.get(2).contains("PROJ-5"));
    }

    @Test
    void detailShowsFieldsDescriptionAndComments() {
        controller.loadInitial();
        controller.handle(AppEvent.SELECT);

        var lines = text(TicketDetailView.render(state, WIDTH, 100));

        assertEquals("PROJ-1  First", lines.get(0));
        assertTrue(lines.contains("Status:    To Do"));
        assertTrue(lines.contains("Assignee:  Unassigned"));
        assertTrue(lines.contains("  (no description)"));
        assertTrue(lines.contains("Comments (1)"));
        var header = lines.stream().filter(l -> l.startsWith("  Author c1 · ")).findFirst();
        assertTrue(header.isPresent());
        assertFalse(header.get().contains("(edited)"));
        assertTrue(lines.contains("  Looks good"));
    }

    @Test
    void detailIsCutToHeight() {
        controller.loadInitial();
        controller.handle(AppEvent.SELECT);
        assertEquals(3, TicketDetailView.render(state, WIDTH, 3).size());
    }

    @Test
    void detailWithoutIssue() {
        assertEquals(List.of("No ticket loaded"), text(TicketDetailView.render(state, WIDTH, 10)));
    }

    @Test
    void transitionsHighlightFocusedRow() {
        controller.loadInitial();
        controller.handle(AppEvent.SELECT);
        controller.handle(AppEvent.SHOW_TRANSITIONS);

        var lines = text(TransitionListView.render(state, WIDTH, 10));

        assertEquals("Transitions for PROJ-1", lines.get(0));
        assertTrue(lines.get(1).startsWith("> Start Progress → In Progress"));
    }

    @Test
    void footerPrefersPromptThenErrorThenMessageThenHints() {
        controller.loadInitial();
        assertTrue(StatusLine.footer(state, null, WIDTH).toString().contains("j/k move"));
        assertTrue(StatusLine.footer(state, "typing", WIDTH).toString().contains("typing_"));

        client.failOn("search", LazyJiraException.api(500, "down"));
        controller.handle(AppEvent.REFRESH);
        assertEquals(
                " Failed to load tickets: API error (500): down",
                StatusLine.footer(state, null, WIDTH).toString());
        assertTrue(StatusLine.footer(state, "x", WIDTH).toString().startsWith("Comment"));

        client.clearFailure("search");
        controller.handle(AppEvent.LOAD_MORE);
        assertEquals(" No more issues", StatusLine.footer(state, null, WIDTH).toString());
    }

    @Test
    void headerNamesInstanceAndView() {
        var header = StatusLine.header(state, WIDTH).toString();
        assertTrue(header.startsWith(" LazyJira │ example.atlassian.net │ Tickets"));
        assertEquals(WIDTH, header.length());
    }

    @Test
    void frameFillsTheScreen() {
        controller.loadInitial();

        var frame = TerminalUi.frame(state, null, 120, 12);

        assertEquals(12, frame.size());
        assertTrue(frame.get(0).toString().contains("LazyJira"));
        assertEquals("Tickets (5)", frame.get(1).toString());
        assertTrue(frame.get(11).toString().contains("q quit"));
    }

    @Test
    void createTicketFramePlaceholder() {
        controller.loadInitial();
        controller.handle(AppEvent.CREATE_TICKET);

        var frame = TerminalUi.frame(state, null, 80, 5);

        assertEquals("Ticket creation is not available yet.", frame.get(1).toString());
    }
}
