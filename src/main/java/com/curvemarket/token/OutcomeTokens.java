package com.curvemarket.token;

import com.curvemarket.domain.enums.OutcomeSide;
import com.curvemarket.gateway.OutcomeToken;
import com.curvemarket.state.RollbackSupport;
import java.util.ArrayList;
import java.util.List;

/** The YES and NO tokens of one market. */
public class OutcomeTokens implements RollbackSupport {

    private final OutcomeToken yes;
    private final OutcomeToken no;

    public OutcomeTokens(OutcomeToken yes, OutcomeToken no) {
        this.yes = yes;
        this.no = no;
    }

    public OutcomeToken of(OutcomeSide side) {
        return side == OutcomeSide.YES ? yes : no;
    }

    @Override
    public Runnable checkpoint() {
        List<Runnable> restorers = new ArrayList<>();
        for (OutcomeToken token : List.of(yes, no)) {
            if (token instanceof RollbackSupport rollback) {
                restorers.add(rollback.checkpoint());
            }
        }
        return () -> restorers.forEach(Runnable::run);
    }
}
