package dev.fumaz.augment.registry;

public enum MemberKind {

    METHOD,
    FIELD

}
