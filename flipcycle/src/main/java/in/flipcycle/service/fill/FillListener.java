package in.flipcycle.service.fill;

import in.flipcycle.domain.ladder.FillEvent;

@FunctionalInterface
public interface FillListener {
    void onFill(FillEvent event);
}
