package org.carball.bom.model.part;

public enum PartKind {
    CHOICE,
    ALIAS,
    FRACTIONAL
}
