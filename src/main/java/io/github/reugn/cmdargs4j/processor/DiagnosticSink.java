package io.github.reugn.cmdargs4j.processor;

/**
 * Receives schema problems as they are found.
 */
@FunctionalInterface
interface DiagnosticSink {
    /**
     * Reports a rule violation on the given member.
     *
     * @param rule   the violated rule
     * @param member the member where the problem was found
     * @param args   the rule's payload values
     */
    void report(Rule rule, Member member, Object... args);
}
