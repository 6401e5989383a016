package com.pushcast.dispatcher.registry;

import com.pushcast.dispatcher.model.InvalidPayloadException;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Predicate;

/**
 * A parsed topic condition such as
 * {@code 'sports' in topics && ('news' in topics || 'weather' in topics)}.
 *
 * Grammar (the push gateway's condition syntax):
 * <pre>
 *   or      := and ( '||' and )*
 *   and     := unary ( '&&' unary )*
 *   unary   := '!' unary | primary
 *   primary := '(' or ')' | quoted-topic 'in' 'topics'
 * </pre>
 * At most {@value #MAX_TOPICS} distinct topics may be referenced.
 */
public final class TopicCondition {

    public static final int MAX_TOPICS = 5;

    private final String                   expression;
    private final Set<String>              topics;
    private final Predicate<Set<String>>   predicate;

    private TopicCondition(String expression, Set<String> topics, Predicate<Set<String>> predicate) {
        this.expression = expression;
        this.topics     = Collections.unmodifiableSet(topics);
        this.predicate  = predicate;
    }

    /**
     * @throws InvalidPayloadException if the expression is malformed or
     *         references too many topics
     */
    public static TopicCondition parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidPayloadException("Condition is empty");
        }
        Parser parser = new Parser(expression);
        Predicate<Set<String>> predicate = parser.parseOr();
        parser.skipWhitespace();
        if (!parser.atEnd()) {
            throw parser.error("unexpected trailing input");
        }
        if (parser.topics.size() > MAX_TOPICS) {
            throw new InvalidPayloadException(
                    "Condition references " + parser.topics.size() + " topics; at most " + MAX_TOPICS + " allowed");
        }
        return new TopicCondition(expression, parser.topics, predicate);
    }

    /** Every topic named in the expression. */
    public Set<String> topics() {
        return topics;
    }

    /** Whether a token subscribed to {@code subscribed} satisfies the condition. */
    public boolean matches(Set<String> subscribed) {
        return predicate.test(subscribed);
    }

    @Override
    public String toString() {
        return expression;
    }

    // ------------------------------------------------------------------
    // Recursive-descent parser
    // ------------------------------------------------------------------

    private static final class Parser {

        private final String input;
        private int pos;
        private final Set<String> topics = new LinkedHashSet<>();

        Parser(String input) {
            this.input = input;
        }

        Predicate<Set<String>> parseOr() {
            Predicate<Set<String>> left = parseAnd();
            while (consume("||")) {
                left = left.or(parseAnd());
            }
            return left;
        }

        Predicate<Set<String>> parseAnd() {
            Predicate<Set<String>> left = parseUnary();
            while (consume("&&")) {
                left = left.and(parseUnary());
            }
            return left;
        }

        Predicate<Set<String>> parseUnary() {
            if (consume("!")) {
                return parseUnary().negate();
            }
            return parsePrimary();
        }

        Predicate<Set<String>> parsePrimary() {
            if (consume("(")) {
                Predicate<Set<String>> inner = parseOr();
                if (!consume(")")) {
                    throw error("expected ')'");
                }
                return inner;
            }
            String topic = parseQuoted();
            if (!consumeWord("in") || !consumeWord("topics")) {
                throw error("expected \"in topics\" after '" + topic + "'");
            }
            topics.add(topic);
            return subscribed -> subscribed.contains(topic);
        }

        private String parseQuoted() {
            skipWhitespace();
            if (atEnd()) {
                throw error("expected a quoted topic");
            }
            char quote = input.charAt(pos);
            if (quote != '\'' && quote != '"') {
                throw error("expected a quoted topic");
            }
            int end = input.indexOf(quote, pos + 1);
            if (end < 0) {
                throw error("unterminated topic name");
            }
            String topic = input.substring(pos + 1, end);
            if (topic.isEmpty()) {
                throw error("empty topic name");
            }
            pos = end + 1;
            return topic;
        }

        private boolean consume(String symbol) {
            skipWhitespace();
            if (input.startsWith(symbol, pos)) {
                pos += symbol.length();
                return true;
            }
            return false;
        }

        // A keyword must not run into the next identifier character.
        private boolean consumeWord(String word) {
            skipWhitespace();
            int end = pos + word.length();
            if (input.startsWith(word, pos)
                    && (end == input.length() || !Character.isLetterOrDigit(input.charAt(end)))) {
                pos = end;
                return true;
            }
            return false;
        }

        void skipWhitespace() {
            while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
                pos++;
            }
        }

        boolean atEnd() {
            return pos >= input.length();
        }

        InvalidPayloadException error(String message) {
            return new InvalidPayloadException(
                    "Invalid condition \"" + input + "\" at position " + pos + ": " + message);
        }
    }
}
