package io.convotest.core.testcase;

import io.convotest.core.persona.ChildData;
import io.convotest.core.persona.Persona;
import java.util.Objects;

@FunctionalInterface
public interface InitialMessage {

    String render(Persona persona);

    static InitialMessage literal(String text) {
        Objects.requireNonNull(text, "text must not be null");
        return persona -> text;
    }

    static InitialMessage template(String text) {
        Objects.requireNonNull(text, "text must not be null");
        return persona -> {
            ChildData child = persona.inventory().child(0);
            return text
                .replace("{parentName}", persona.inventory().parentFullName())
                .replace("{parentFirstName}", persona.inventory().parentFirstName())
                .replace("{childName}", child == null ? "my child" : child.firstName())
                .replace("{childCount}", String.valueOf(persona.inventory().children().size()));
        };
    }
}
