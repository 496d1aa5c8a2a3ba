package org.truthtable.syntax;

/**
 * Associatività degli operatori del linguaggio.
 */
public enum Associativity {
    LEFT,   // a op b op c ~ (a op b) op c
    RIGHT   // op op a ~ op (op a)
}
