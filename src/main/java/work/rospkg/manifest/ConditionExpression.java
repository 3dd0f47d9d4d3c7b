package work.rospkg.manifest;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parsed form of a manifest {@code condition} attribute, e.g. {@code $ROS_VERSION == 2 and $ROS_PYTHON_VERSION != 2}.
 *
 * <p>Operands are either {@code $NAME} references (looked up in the environment, missing names read as
 * the empty string) or bare words made of letters, digits, {@code _} and {@code -}. Comparisons are plain
 * string comparisons. {@code and} binds tighter than {@code or}; parentheses group.
 */
public final class ConditionExpression {
    private final String source;
    private final Node root;

    private ConditionExpression(String source, Node root) {
        this.source = source;
        this.root = root;
    }

    /**
     * Parses the expression; a {@code null} condition always evaluates to {@code true}, an empty one is malformed.
     *
     * @throws IllegalArgumentException when the expression is malformed
     */
    public static ConditionExpression parse(String condition) {
        if (condition == null) {
            return new ConditionExpression(condition, env -> true);
        }
        var parser = new Parser(condition, tokenize(condition));
        Node root = parser.parseOr();
        parser.expectEnd();
        return new ConditionExpression(condition, root);
    }

    public static boolean evaluate(String condition, Map<String, String> environment) {
        return parse(condition).evaluate(environment);
    }

    public boolean evaluate(Map<String, String> environment) {
        return root.evaluate(environment == null ? Map.of() : environment);
    }

    public String source() {
        return source;
    }

    @Override
    public String toString() {
        return Objects.toString(source, "");
    }

    private interface Node {
        boolean evaluate(Map<String, String> env);
    }

    private enum TokenKind {
        WORD,
        VARIABLE,
        OPERATOR,
        AND,
        OR,
        OPEN,
        CLOSE
    }

    private record Token(TokenKind kind, String text, int position) {}

    private static List<Token> tokenize(String condition) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < condition.length()) {
            char ch = condition.charAt(i);
            if (Character.isWhitespace(ch)) {
                i++;
            } else if (ch == '(') {
                tokens.add(new Token(TokenKind.OPEN, "(", i++));
            } else if (ch == ')') {
                tokens.add(new Token(TokenKind.CLOSE, ")", i++));
            } else if (ch == '=' || ch == '!' || ch == '<' || ch == '>') {
                int start = i;
                if (i + 1 < condition.length() && condition.charAt(i + 1) == '=') {
                    i += 2;
                } else if (ch == '<' || ch == '>') {
                    i++;
                } else {
                    throw invalid(condition, "unexpected '" + ch + "'", start);
                }
                tokens.add(new Token(TokenKind.OPERATOR, condition.substring(start, i), start));
            } else if (ch == '$') {
                int start = i++;
                while (i < condition.length() && isIdentifierChar(condition.charAt(i))) {
                    i++;
                }
                if (i == start + 1) {
                    throw invalid(condition, "'$' must be followed by a variable name", start);
                }
                tokens.add(new Token(TokenKind.VARIABLE, condition.substring(start + 1, i), start));
            } else if (isWordChar(ch)) {
                int start = i;
                while (i < condition.length() && isWordChar(condition.charAt(i))) {
                    i++;
                }
                String word = condition.substring(start, i);
                TokenKind kind = switch (word) {
                    case "and" -> TokenKind.AND;
                    case "or" -> TokenKind.OR;
                    default -> TokenKind.WORD;
                };
                tokens.add(new Token(kind, word, start));
            } else {
                throw invalid(condition, "unexpected '" + ch + "'", i);
            }
        }
        return tokens;
    }

    private static boolean isIdentifierChar(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_';
    }

    private static boolean isWordChar(char ch) {
        return isIdentifierChar(ch) || ch == '-';
    }

    private static IllegalArgumentException invalid(String condition, String problem, int position) {
        return new IllegalArgumentException(
            "Invalid condition '" + condition + "' at position " + position + ": " + problem);
    }

    private static final class Parser {
        private final String condition;
        private final List<Token> tokens;
        private int index;

        Parser(String condition, List<Token> tokens) {
            this.condition = condition;
            this.tokens = tokens;
        }

        Node parseOr() {
            Node left = parseAnd();
            while (accept(TokenKind.OR)) {
                Node lhs = left;
                Node rhs = parseAnd();
                left = env -> lhs.evaluate(env) || rhs.evaluate(env);
            }
            return left;
        }

        Node parseAnd() {
            Node left = parseOperand();
            while (accept(TokenKind.AND)) {
                Node lhs = left;
                Node rhs = parseOperand();
                left = env -> lhs.evaluate(env) && rhs.evaluate(env);
            }
            return left;
        }

        Node parseOperand() {
            if (accept(TokenKind.OPEN)) {
                Node inner = parseOr();
                if (!accept(TokenKind.CLOSE)) {
                    throw invalid(condition, "missing ')'", positionOfNext());
                }
                return inner;
            }
            Operand left = parseTerm();
            Token operator = next("a comparison operator");
            if (operator.kind() != TokenKind.OPERATOR) {
                throw invalid(condition, "expected a comparison operator but found '" + operator.text() + "'",
                    operator.position());
            }
            Operand right = parseTerm();
            return comparison(operator.text(), left, right);
        }

        Operand parseTerm() {
            Token token = next("a value");
            return switch (token.kind()) {
                case VARIABLE -> env -> env.getOrDefault(token.text(), "");
                case WORD -> env -> token.text();
                default -> throw invalid(condition, "expected a value but found '" + token.text() + "'",
                    token.position());
            };
        }

        void expectEnd() {
            if (index < tokens.size()) {
                Token token = tokens.get(index);
                throw invalid(condition, "unexpected '" + token.text() + "'", token.position());
            }
        }

        private boolean accept(TokenKind kind) {
            if (index < tokens.size() && tokens.get(index).kind() == kind) {
                index++;
                return true;
            }
            return false;
        }

        private Token next(String expected) {
            if (index >= tokens.size()) {
                throw invalid(condition, "expected " + expected + " but reached the end", condition.length());
            }
            return tokens.get(index++);
        }

        private int positionOfNext() {
            return index < tokens.size() ? tokens.get(index).position() : condition.length();
        }
    }

    private interface Operand {
        String value(Map<String, String> env);
    }

    private static Node comparison(String operator, Operand left, Operand right) {
        return switch (operator) {
            case "==" -> env -> left.value(env).equals(right.value(env));
            case "!=" -> env -> !left.value(env).equals(right.value(env));
            case "<" -> env -> left.value(env).compareTo(right.value(env)) < 0;
            case "<=" -> env -> left.value(env).compareTo(right.value(env)) <= 0;
            case ">" -> env -> left.value(env).compareTo(right.value(env)) > 0;
            case ">=" -> env -> left.value(env).compareTo(right.value(env)) >= 0;
            default -> throw new IllegalStateException("Unsupported operator " + operator);
        };
    }
}
