package io.github.drompincen.aigov.protocol.api;

import java.util.Collection;
import java.util.stream.Collectors;

public record Participant(ParticipantType type, String id) {

    public static Participant role(String roleName) {
        return new Participant(ParticipantType.ROLE, roleName);
    }

    public String key() {
        return type.name().toLowerCase() + ":" + id;
    }

    /** Order-independent key of a participant set. */
    public static String setKey(Collection<Participant> participants) {
        return participants.stream()
                .map(Participant::key)
                .sorted()
                .collect(Collectors.joining("|"));
    }
}
