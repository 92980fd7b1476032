package com.questrail.choreography.parser;

import com.questrail.choreography.model.Action;
import com.questrail.choreography.model.Choice;
import com.questrail.choreography.model.Continue;
import com.questrail.choreography.model.ImportDeclaration;
import com.questrail.choreography.model.Interaction;
import com.questrail.choreography.model.Parallel;
import com.questrail.choreography.model.ProtocolDeclaration;
import com.questrail.choreography.model.ProtocolModule;
import com.questrail.choreography.model.Recursion;
import com.questrail.choreography.model.Role;
import com.questrail.choreography.model.Sequence;
import com.questrail.choreography.model.SourcePosition;
import com.questrail.choreography.model.TypeAlias;
import com.questrail.choreography.model.TypeRef;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * ProtocolParser
 * -----------------------------------------------------------------------------
 * Recursive-descent parser for the choreography language.
 *
 * <pre>
 *   module      → ( import | typeDecl | declaration )* EOF ;
 *   import      → "import" STRING ( "{" IDENT ( "," IDENT )* "}" )? ";" ;
 *   typeDecl    → "type" IDENT "as" typeExpr ";" ;
 *   declaration → "global"? "protocol" IDENT "(" roleDecl ( "," roleDecl )* ")" block ;
 *   roleDecl    → "role" IDENT ;
 *   block       → "{" statement* "}" ;
 *   statement   → choice | parallel | recursion | continue | arrowMsg | keywordMsg ;
 *   choice      → "choice" "at" IDENT block ( "or" block )+ ;
 *   parallel    → "par" block ( "and" block )+ ;
 *   recursion   → "rec" IDENT block ;
 *   continue    → "continue" IDENT ";" ;
 *   arrowMsg    → IDENT "->" receivers ":" message ";" ;
 *   keywordMsg  → message "from" IDENT "to" receivers ";" ;
 *   receivers   → IDENT ( "," IDENT )* ;
 *   message     → IDENT "(" typeExpr? ")" ;
 *   typeExpr    → IDENT ( "<" typeExpr ( "," typeExpr )* ">" )? ;
 * </pre>
 *
 * <h2>Scope rules</h2>
 * Besides grammar, the parser enforces the rules that need only lexical
 * scope:
 * <ul>
 *   <li>every referenced role is declared in the protocol header</li>
 *   <li>every {@code continue} is nested inside a {@code rec} of that label</li>
 *   <li>{@code choice} and {@code par} have at least two alternatives</li>
 * </ul>
 * A message with several receivers is desugared into one {@link Action} per
 * receiver, in receiver order.
 *
 * <p>
 * The parser performs no CFG construction. Instances are single-use.
 * </p>
 */
public final class ProtocolParser
{
    private final List<Token> tokens;
    private int current = 0;

    // Per-declaration scope
    private final Set<Role> declaredRoles = new LinkedHashSet<>();
    private final Deque<String> recursionLabels = new ArrayDeque<>();

    public ProtocolParser(Lexer lexer) {
        this.tokens = Objects.requireNonNull(lexer, "lexer").tokenize();
    }

    public ProtocolParser(String source) {
        this(new Lexer(source));
    }

    /**
     * Parses the whole input as a module of imports, type aliases and protocol
     * declarations, in any order.
     *
     * @throws ParseException on the first lexical, grammatical or scope error
     */
    public ProtocolModule parseModule() {
        List<ImportDeclaration> imports = new ArrayList<>();
        List<TypeAlias> aliases = new ArrayList<>();
        List<ProtocolDeclaration> declarations = new ArrayList<>();
        Set<String> names = new HashSet<>();
        Set<String> aliasNames = new HashSet<>();

        while (!check(TokenType.EOF)) {
            if (check(TokenType.IMPORT)) {
                imports.add(importDeclaration());
                continue;
            }
            if (check(TokenType.TYPE)) {
                TypeAlias alias = typeDeclaration();
                if (!aliasNames.add(alias.name())) {
                    throw new ParseException("Duplicate type '" + alias.name() + "'", alias.position());
                }
                aliases.add(alias);
                continue;
            }
            Token start = peek();
            ProtocolDeclaration declaration = declaration();
            if (!names.add(declaration.name())) {
                throw new ParseException("Duplicate protocol '" + declaration.name() + "'", start.position());
            }
            declarations.add(declaration);
        }
        return new ProtocolModule(imports, aliases, declarations);
    }

    // ---------------------------------------------------------------------
    // Module-level declarations
    // ---------------------------------------------------------------------

    // import → "import" STRING ( "{" IDENT ( "," IDENT )* "}" )? ";" ;
    private ImportDeclaration importDeclaration() {
        SourcePosition start = advance().position();
        String path = consume(TokenType.STRING, "Expected quoted module path after 'import'").lexeme();

        List<String> importedNames = new ArrayList<>();
        if (match(TokenType.LBRACE)) {
            do {
                Token name = consume(TokenType.IDENTIFIER, "Expected imported name");
                if (importedNames.contains(name.lexeme())) {
                    throw new ParseException("Name '" + name.lexeme() + "' imported twice", name.position());
                }
                importedNames.add(name.lexeme());
            } while (match(TokenType.COMMA));
            consume(TokenType.RBRACE, "Expected '}' after imported names");
        }
        consume(TokenType.SEMICOLON, "Expected ';' after import");
        return new ImportDeclaration(path, importedNames, start);
    }

    // typeDecl → "type" IDENT "as" typeExpr ";" ;
    private TypeAlias typeDeclaration() {
        SourcePosition start = advance().position();
        String name = consume(TokenType.IDENTIFIER, "Expected type name after 'type'").lexeme();
        consume(TokenType.AS, "Expected 'as' after type name");
        TypeRef type = typeExpr();
        consume(TokenType.SEMICOLON, "Expected ';' after type declaration");
        return new TypeAlias(name, type, start);
    }

    // ---------------------------------------------------------------------
    // Declarations
    // ---------------------------------------------------------------------

    private ProtocolDeclaration declaration() {
        SourcePosition start = peek().position();
        boolean global = match(TokenType.GLOBAL);
        consume(TokenType.PROTOCOL, "Expected 'protocol', 'type' or 'import'");
        String name = consume(TokenType.IDENTIFIER, "Expected protocol name").lexeme();

        declaredRoles.clear();
        recursionLabels.clear();

        consume(TokenType.LPAREN, "Expected '(' after protocol name");
        roleDecl();
        while (match(TokenType.COMMA)) {
            roleDecl();
        }
        consume(TokenType.RPAREN, "Expected ')' after role list");

        Sequence body = block();
        return new ProtocolDeclaration(name, global, List.copyOf(declaredRoles), body, start);
    }

    private void roleDecl() {
        consume(TokenType.ROLE, "Expected 'role'");
        Token name = consume(TokenType.IDENTIFIER, "Expected role name");
        if (!declaredRoles.add(Role.of(name.lexeme()))) {
            throw new ParseException("Duplicate role '" + name.lexeme() + "'", name.position());
        }
    }

    // ---------------------------------------------------------------------
    // Statements
    // ---------------------------------------------------------------------

    private Sequence block() {
        SourcePosition start = consume(TokenType.LBRACE, "Expected '{'").position();
        List<Interaction> items = new ArrayList<>();
        while (!check(TokenType.RBRACE) && !check(TokenType.EOF)) {
            statement(items);
        }
        consume(TokenType.RBRACE, "Expected '}'");
        return new Sequence(items, start);
    }

    private void statement(List<Interaction> into) {
        Token token = peek();
        switch (token.type()) {
            case CHOICE -> into.add(choice());
            case PAR -> into.add(parallel());
            case REC -> into.add(recursion());
            case CONTINUE -> into.add(continueStatement());
            case IDENTIFIER -> {
                if (checkNext(TokenType.ARROW)) {
                    arrowMessage(into);
                } else if (checkNext(TokenType.LPAREN)) {
                    keywordMessage(into);
                } else {
                    throw error(peekNext(), "Expected '->' or '(' after " + token.describe());
                }
            }
            default -> throw error(token, "Expected a statement");
        }
    }

    // choice → "choice" "at" IDENT block ( "or" block )+ ;
    private Choice choice() {
        SourcePosition start = advance().position();
        consume(TokenType.AT, "Expected 'at' after 'choice'");
        Role at = roleReference();

        List<Interaction> options = new ArrayList<>();
        options.add(block());
        while (match(TokenType.OR)) {
            options.add(block());
        }
        if (options.size() < 2) {
            throw new ParseException("choice at " + at + " needs at least two options", start);
        }
        return new Choice(at, options, start);
    }

    // parallel → "par" block ( "and" block )+ ;
    private Parallel parallel() {
        SourcePosition start = advance().position();

        List<Interaction> branches = new ArrayList<>();
        branches.add(block());
        while (match(TokenType.AND)) {
            branches.add(block());
        }
        if (branches.size() < 2) {
            throw new ParseException("par needs at least two branches", start);
        }
        return new Parallel(branches, start);
    }

    // recursion → "rec" IDENT block ;
    private Recursion recursion() {
        SourcePosition start = advance().position();
        String label = consume(TokenType.IDENTIFIER, "Expected recursion label after 'rec'").lexeme();

        recursionLabels.push(label);
        try {
            return new Recursion(label, block(), start);
        } finally {
            recursionLabels.pop();
        }
    }

    // continue → "continue" IDENT ";" ;
    private Continue continueStatement() {
        SourcePosition start = advance().position();
        Token label = consume(TokenType.IDENTIFIER, "Expected recursion label after 'continue'");
        if (!recursionLabels.contains(label.lexeme())) {
            throw new ParseException("continue " + label.lexeme()
                    + " has no enclosing rec " + label.lexeme(), label.position());
        }
        consume(TokenType.SEMICOLON, "Expected ';' after continue");
        return new Continue(label.lexeme(), start);
    }

    // arrowMsg → IDENT "->" receivers ":" message ";" ;
    private void arrowMessage(List<Interaction> into) {
        SourcePosition start = peek().position();
        Role from = roleReference();
        consume(TokenType.ARROW, "Expected '->'");
        List<Role> receivers = receivers(from);
        consume(TokenType.COLON, "Expected ':' after receiver");
        MessageSignature message = message();
        consume(TokenType.SEMICOLON, "Expected ';' after message");

        emit(into, from, receivers, message, start);
    }

    // keywordMsg → message "from" IDENT "to" receivers ";" ;
    private void keywordMessage(List<Interaction> into) {
        SourcePosition start = peek().position();
        MessageSignature message = message();
        consume(TokenType.FROM, "Expected 'from' after message");
        Role from = roleReference();
        consume(TokenType.TO, "Expected 'to' after sender");
        List<Role> receivers = receivers(from);
        consume(TokenType.SEMICOLON, "Expected ';' after message");

        emit(into, from, receivers, message, start);
    }

    private void emit(List<Interaction> into,
                      Role from,
                      List<Role> receivers,
                      MessageSignature message,
                      SourcePosition start) {
        for (Role to : receivers) {
            into.add(new Action(from, to, message.label(), message.payload(), start));
        }
    }

    private List<Role> receivers(Role from) {
        List<Role> receivers = new ArrayList<>();
        do {
            Token token = peek();
            Role to = roleReference();
            if (to.equals(from)) {
                throw new ParseException("Role '" + to + "' cannot send a message to itself", token.position());
            }
            if (receivers.contains(to)) {
                throw new ParseException("Receiver '" + to + "' listed twice", token.position());
            }
            receivers.add(to);
        } while (match(TokenType.COMMA));
        return receivers;
    }

    private record MessageSignature(String label, TypeRef payload) {}

    // message → IDENT "(" typeExpr? ")" ;
    private MessageSignature message() {
        String label = consume(TokenType.IDENTIFIER, "Expected message label").lexeme();
        consume(TokenType.LPAREN, "Expected '(' after message label");
        TypeRef payload = check(TokenType.IDENTIFIER) ? typeExpr() : null;
        consume(TokenType.RPAREN, "Expected ')' after payload");
        return new MessageSignature(label, payload);
    }

    // typeExpr → IDENT ( "<" typeExpr ( "," typeExpr )* ">" )? ;
    private TypeRef typeExpr() {
        String name = consume(TokenType.IDENTIFIER, "Expected type name").lexeme();
        if (!match(TokenType.LANGLE)) {
            return TypeRef.simple(name);
        }
        List<TypeRef> arguments = new ArrayList<>();
        arguments.add(typeExpr());
        while (match(TokenType.COMMA)) {
            arguments.add(typeExpr());
        }
        consume(TokenType.RANGLE, "Expected '>' after type arguments");
        return new TypeRef(name, arguments);
    }

    private Role roleReference() {
        Token name = consume(TokenType.IDENTIFIER, "Expected role name");
        Role role = Role.of(name.lexeme());
        if (!declaredRoles.contains(role)) {
            throw new ParseException("Undeclared role '" + name.lexeme() + "'", name.position());
        }
        return role;
    }

    // ---------------------------------------------------------------------
    // Token helpers
    // ---------------------------------------------------------------------

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekNext() {
        return tokens.get(Math.min(current + 1, tokens.size() - 1));
    }

    private boolean check(TokenType type) {
        return peek().is(type);
    }

    private boolean checkNext(TokenType type) {
        return peekNext().is(type);
    }

    private Token advance() {
        Token token = peek();
        if (!token.is(TokenType.EOF)) {
            current++;
        }
        return token;
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(peek(), message);
    }

    private ParseException error(Token token, String message) {
        return new ParseException(message + " (found " + token.describe() + ")", token.position());
    }
}
