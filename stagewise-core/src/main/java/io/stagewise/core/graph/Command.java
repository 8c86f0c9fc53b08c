package io.stagewise.core.graph;

import io.stagewise.core.state.StatePatch;
import java.util.List;
import java.util.Objects;

/// Output of a node invocation: the state change plus where to go next.
///
/// @param patch state change to merge, never null (use {@link StatePatch#EMPTY})
/// @param route routing decision, not null
public record Command(StatePatch patch, Route route) {

    public Command {
        patch = patch != null ? patch : StatePatch.EMPTY;
        Objects.requireNonNull(route, "route must not be null");
    }

    public static Command next(StatePatch patch) {
        return new Command(patch, new Route.Next());
    }

    public static Command goTo(String target, StatePatch patch) {
        return new Command(patch, new Route.Goto(target));
    }

    public static Command fanOut(StatePatch patch, String... targets) {
        return new Command(patch, new Route.FanOut(List.of(targets)));
    }

    public static Command end(StatePatch patch) {
        return new Command(patch, new Route.End());
    }

    public static Command terminate(StatePatch patch) {
        return new Command(patch, new Route.Terminate());
    }
}
