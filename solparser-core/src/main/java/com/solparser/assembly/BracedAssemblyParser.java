package com.solparser.assembly;

import com.solparser.ErrorReporter;
import com.solparser.TokenSource;
import com.solparser.TokenType;
import com.solparser.ast.SourceLocation;

/**
 * Treats an assembly block as a balanced run of braces and keeps its text verbatim.
 */
public class BracedAssemblyParser implements InlineAssemblyParser {

    @Override
    public AssemblyBlock parse(TokenSource scanner, ErrorReporter reporter) {
        SourceLocation open = scanner.currentLocation();
        if (scanner.currentToken() != TokenType.LBRACE) {
            reporter.error(2314, open, "Expected '{' but got " + describe(scanner.currentToken()));
            return null;
        }

        int depth = 0;
        while (true) {
            TokenType token = scanner.currentToken();
            if (token == TokenType.EOS) {
                reporter.error(2314, scanner.currentLocation(), "Expected '}' but got end of source");
                return null;
            }
            if (token == TokenType.LBRACE) {
                depth++;
            } else if (token == TokenType.RBRACE) {
                depth--;
                if (depth == 0) {
                    int end = scanner.currentLocation().end();
                    scanner.next();
                    SourceLocation location = new SourceLocation(open.start(), end, open.sourceName());
                    return new AssemblyBlock(location, scanner.text(open.start(), end));
                }
            }
            scanner.next();
        }
    }

    private static String describe(TokenType token) {
        return token == TokenType.EOS ? "end of source" : "'" + token.friendlyName() + "'";
    }
}
