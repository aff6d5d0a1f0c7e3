package com.solparser;

import com.solparser.ast.*;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.solparser.TestParsing.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Structural checks that hold for every tree: well-formed ranges nested inside
 * their parents, unique ids and deterministic output.
 */
public class LocationInvariantTest {

    private static final String SOURCE = LICENSE + """
        pragma solidity >=0.6.0 <0.8.0;
        import {A as B} from "a.sol";

        /// Vault
        contract Vault is Base(1) {
            using Math for uint;
            /// total
            uint public total;
            mapping(address => uint[]) private shares;
            function() external returns (uint) hook;
            event Moved(address indexed who, uint amount);
            modifier guarded(uint x) { require(x > 0, "zero"); _; }

            function move(address payable to, uint amount) external guarded(amount) returns (bool ok) {
                uint[] memory parts = new uint[](2);
                (uint a, , uint b) = split(amount);
                x[1] storage slot = data[1];
                data[1] = a + b * 2 ** 3;
                for (uint i = 0; i < parts.length; i++) { parts[i] = i; }
                if (amount > 1 ether) { emit Moved(to, amount); } else revert("small");
                try this.ping{gas: 100}() returns (uint v) { total = v; } catch Error(string memory) { }
                assembly { let y := 1 }
                to.transfer(amount);
                return payable(to) == to ? true : false;
            }
        }
        """;

    @Test
    void testRangesAreWellFormedAndNested() {
        SourceUnit unit = parseClean(SOURCE);
        assertTrue(unit.location().isValid());
        for (Node node : allNodes(unit)) {
            SourceLocation location = node.location();
            assertTrue(location.isValid(), () -> node.type() + " has invalid location " + location);
            assertEquals(SOURCE_NAME, location.sourceName());
            assertTrue(location.end() <= SOURCE.length(), () -> node.type() + " ends past the source");
        }
        walk(unit, (parent, child) -> {
            // doc comments precede the construct they document
            if (child instanceof StructuredDocumentation) {
                return;
            }
            assertTrue(parent.location().contains(child.location()),
                () -> child.type() + " " + child.location() + " outside " + parent.type() + " " + parent.location());
        });
    }

    @Test
    void testIdsAreUnique() {
        SourceUnit unit = parseClean(SOURCE);
        Set<Long> ids = new HashSet<>();
        for (Node node : allNodes(unit)) {
            assertTrue(ids.add(node.id()), () -> "duplicate id " + node.id() + " on " + node.type());
        }
    }

    @Test
    void testParsingIsDeterministic() {
        assertEquals(parseClean(SOURCE), parseClean(SOURCE));
    }

    @Test
    void testIdentifierRangeMatchesSourceText() {
        SourceUnit unit = parseClean(SOURCE);
        List<Identifier> identifiers = allNodes(unit).stream()
            .filter(Identifier.class::isInstance)
            .map(Identifier.class::cast)
            .toList();
        assertFalse(identifiers.isEmpty());
        for (Identifier identifier : identifiers) {
            SourceLocation location = identifier.location();
            assertEquals(identifier.name(), SOURCE.substring(location.start(), location.end()));
        }
    }

    @Test
    void testDocumentationRangeCoversComment() {
        ContractDefinition vault = firstContract(parseClean(SOURCE));
        SourceLocation location = vault.documentation().location();
        assertEquals("/// Vault", SOURCE.substring(location.start(), location.end()));
    }
}
