package com.player.matching.core.model;

import java.util.Objects;

/**
 * One person entry from either the reference roster or an event file.
 * String fields hold the raw input form; a missing birth component is {@code null}.
 * The comparable form is derived separately and never written back here.
 */
public record PlayerRecord(
        String externalId,
        String lastName,
        String firstName,
        String sex,
        String association,
        Integer dayOfBirth,
        Integer monthOfBirth,
        Integer yearOfBirth
) {
    public PlayerRecord {
        externalId = externalId != null ? externalId : "";
        lastName = lastName != null ? lastName : "";
        firstName = firstName != null ? firstName : "";
        sex = sex != null ? sex : "";
        association = association != null ? association : "";
    }

    /**
     * Returns a builder pre-populated with this record's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .externalId(externalId)
                .lastName(lastName)
                .firstName(firstName)
                .sex(sex)
                .association(association)
                .dayOfBirth(dayOfBirth)
                .monthOfBirth(monthOfBirth)
                .yearOfBirth(yearOfBirth);
    }

    /**
     * Returns "Last, First" for log output.
     */
    public String displayName() {
        return lastName + ", " + firstName;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String externalId;
        private String lastName;
        private String firstName;
        private String sex;
        private String association;
        private Integer dayOfBirth;
        private Integer monthOfBirth;
        private Integer yearOfBirth;

        public Builder externalId(String externalId) {
            this.externalId = externalId;
            return this;
        }

        public Builder lastName(String lastName) {
            this.lastName = lastName;
            return this;
        }

        public Builder firstName(String firstName) {
            this.firstName = firstName;
            return this;
        }

        public Builder sex(String sex) {
            this.sex = sex;
            return this;
        }

        public Builder association(String association) {
            this.association = association;
            return this;
        }

        public Builder dayOfBirth(Integer dayOfBirth) {
            this.dayOfBirth = dayOfBirth;
            return this;
        }

        public Builder monthOfBirth(Integer monthOfBirth) {
            this.monthOfBirth = monthOfBirth;
            return this;
        }

        public Builder yearOfBirth(Integer yearOfBirth) {
            this.yearOfBirth = yearOfBirth;
            return this;
        }

        public Builder birthDate(int day, int month, int year) {
            this.dayOfBirth = day;
            this.monthOfBirth = month;
            this.yearOfBirth = year;
            return this;
        }

        public PlayerRecord build() {
            Objects.requireNonNull(lastName, "lastName is required");
            Objects.requireNonNull(firstName, "firstName is required");
            return new PlayerRecord(externalId, lastName, firstName, sex, association,
                    dayOfBirth, monthOfBirth, yearOfBirth);
        }
    }
}
