package com.curvemarket.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/** Audit trail for changes of the market authority. */
@Getter
public class AuthorityRotatedEvent extends ApplicationEvent {

    private final String previousAuthority;
    private final String newAuthority;

    public AuthorityRotatedEvent(Object source, String previousAuthority, String newAuthority) {
        super(source);
        this.previousAuthority = previousAuthority;
        this.newAuthority = newAuthority;
    }
}
