package arachne_chat_gateway.session;

import arachne_chat_gateway.model.Session;
import lombok.Value;

@Value
public class RefreshOutcome {

    boolean ok;
    boolean rejected;
    Session session;

    public static RefreshOutcome ok(Session session) {
        return new RefreshOutcome(true, false, session);
    }

    public static RefreshOutcome failed(boolean rejected) {
        return new RefreshOutcome(false, rejected, Session.anonymous());
    }
}
