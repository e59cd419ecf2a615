package org.nowstart.stratagem.pipeline;

import org.nowstart.stratagem.data.type.NodeName;
import org.nowstart.stratagem.data.type.RouteAction;
import org.nowstart.stratagem.data.type.SessionStatus;

public record RouteDecision(RouteAction action, NodeName target, String reason, SessionStatus finalStatus) {

    public static RouteDecision goTo(NodeName target) {
        return new RouteDecision(RouteAction.GOTO, target, null, null);
    }

    public static RouteDecision suspend(String reason) {
        return new RouteDecision(RouteAction.SUSPEND, null, reason, null);
    }

    public static RouteDecision terminate(SessionStatus finalStatus) {
        return new RouteDecision(RouteAction.TERMINATE, null, null, finalStatus);
    }
}
