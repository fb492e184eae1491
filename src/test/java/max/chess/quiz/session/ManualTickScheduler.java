package max.chess.quiz.session;

import java.util.ArrayList;
import java.util.List;

// Ticks only when told to
final class ManualTickScheduler implements TickScheduler {
    private final List<Runnable> scheduled = new ArrayList<>();

    @Override
    public TickHandle schedule(Runnable tick) {
        scheduled.add(tick);
        return () -> scheduled.remove(tick);
    }

    void fire(int times) {
        for(int i = 0; i < times; i++) {
            for(Runnable tick : new ArrayList<>(scheduled)) {
                tick.run();
            }
        }
    }

    int liveCount() {
        return scheduled.size();
    }
}
