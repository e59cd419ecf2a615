package org.nowstart.stratagem.data.type;

public enum RouteAction {
    GOTO,
    SUSPEND,
    TERMINATE
}
