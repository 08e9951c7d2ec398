package dev.transput.engine;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TransputEventsTest {

    @Test
    void resolve_unregisteredIsNull() {
        assertThat(new TransputEvents().resolve(TransputEvent.FORMAT_END)).isNull();
    }

    @Test
    void on_replacesEarlierHandler() {
        EventHandler first = t -> false;
        EventHandler second = t -> true;
        TransputEvents events = new TransputEvents().on(TransputEvent.PAGE_END, first).on(TransputEvent.PAGE_END, second);

        assertThat(events.resolve(TransputEvent.PAGE_END)).isSameAs(second);
    }

    @Test
    void remove_restoresDefault() {
        TransputEvents events = new TransputEvents().on(TransputEvent.LINE_END, t -> true);

        events.remove(TransputEvent.LINE_END);

        assertThat(events.resolve(TransputEvent.LINE_END)).isNull();
    }
}
