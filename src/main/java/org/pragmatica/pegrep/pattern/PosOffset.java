package org.pragmatica.pegrep.pattern;

/**
 * Length change introduced at one point of the rewritten pattern.
 *
 * @param atLine   line of the substitution in the rewritten text
 * @param atColumn column of the substitution in the rewritten text
 * @param atOffset offset of the substitution in the rewritten text
 * @param length   rewritten length minus original length; negative when the rewrite is shorter
 */
public record PosOffset(int atLine, int atColumn, int atOffset, int length) {}
