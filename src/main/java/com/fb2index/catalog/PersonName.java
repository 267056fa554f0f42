package com.fb2index.catalog;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record PersonName(String firstName, String middleName, String lastName, String nickname) {
    public PersonName {
        firstName = firstName == null ? "" : firstName;
        middleName = middleName == null ? "" : middleName;
        lastName = lastName == null ? "" : lastName;
        nickname = nickname == null ? "" : nickname;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return firstName.isEmpty() && middleName.isEmpty() && lastName.isEmpty() && nickname.isEmpty();
    }

    public List<String> parts() {
        return List.of(firstName, middleName, lastName, nickname);
    }

    public String displayName() {
        String name = Stream.of(firstName, middleName, lastName)
                .filter(part -> !part.isEmpty())
                .collect(Collectors.joining(" "));
        if (nickname.isEmpty()) {
            return name;
        }
        return name.isEmpty() ? nickname : name + " (" + nickname + ")";
    }
}
