package io.jsonsift.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import io.jsonsift.core.format.JsonFormatter;
import io.jsonsift.core.model.Kind;
import io.jsonsift.core.model.Value;
import io.jsonsift.core.modifier.ModifierRegistry;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** End-to-end tests for {@link JsonQuery#get(String, String)} and the operations around it. */
class JsonQueryTest {

    private static final String DOC = "{\"a\":[{\"n\":1},{\"n\":2},{\"n\":3}]}";

    private static final String PEOPLE = """
            {
              "name": {"first": "Tom", "last": "Anderson"},
              "age": 37,
              "children": ["Sara", "Alex", "Jack"],
              "fav.movie": "Deer Hunter",
              "friends": [
                {"first": "Dale", "last": "Murphy", "age": 44, "nets": ["ig", "fb", "tw"]},
                {"first": "Roger", "last": "Craig", "age": 68, "nets": ["fb", "tw"]},
                {"first": "Jane", "last": "Murphy", "age": 47, "nets": ["ig", "tw"]}
              ]
            }
            """;

    private final JsonQuery query = JsonQuery.defaults();

    @Nested
    @DisplayName("scenarios")
    class Scenarios {

        @Test
        @DisplayName("a.# counts the array")
        void countsArray() {
            Value value = query.get(DOC, "a.#");

            assertThat(value.kind()).isEqualTo(Kind.NUMBER);
            assertThat(value.asLong()).isEqualTo(3);
            assertThat(value.origin()).isZero();
        }

        @Test
        @DisplayName("a.1.n reads a nested value")
        void readsNestedValue() {
            assertThat(query.get(DOC, "a.1.n").asLong()).isEqualTo(2);
        }

        @Test
        @DisplayName("a.#(n>1)#.n broadcasts over the matches")
        void broadcastsOverMatches() {
            assertThat(query.get(DOC, "a.#(n>1)#.n").raw()).isEqualTo("[2,3]");
        }

        @Test
        @DisplayName("a.#(n>1)#|0.n pipes the matched array")
        void pipesMatchedArray() {
            assertThat(query.get(DOC, "a.#(n>1)#|0.n").asLong()).isEqualTo(2);
        }

        @Test
        @DisplayName("{\"count\":a.#} builds an object")
        void buildsObject() {
            assertThat(query.get(DOC, "{\"count\":a.#}").raw()).isEqualTo("{\"count\":3}");
        }

        @Test
        @DisplayName("a.@reverse reverses the array")
        void reversesArray() {
            assertThat(query.get(DOC, "a.@reverse").raw()).isEqualTo("[{\"n\":3},{\"n\":2},{\"n\":1}]");
        }
    }

    @Nested
    @DisplayName("keys and indices")
    class KeysAndIndices {

        @Test
        void readsObjectMembers() {
            assertThat(query.get(PEOPLE, "name.last").toString()).isEqualTo("Anderson");
            assertThat(query.get(PEOPLE, "age").asInt()).isEqualTo(37);
            assertThat(query.get(PEOPLE, "children").raw()).isEqualTo("[\"Sara\", \"Alex\", \"Jack\"]");
            assertThat(query.get(PEOPLE, "children.1").toString()).isEqualTo("Alex");
        }

        @Test
        void missingKeyOrIndexIsNonExistent() {
            assertThat(query.get(PEOPLE, "name.middle").exists()).isFalse();
            assertThat(query.get(PEOPLE, "children.3").exists()).isFalse();
            assertThat(query.get(PEOPLE, "age.years").exists()).isFalse();
        }

        @Test
        void wildcardsMatchKeys() {
            assertThat(query.get(PEOPLE, "name.fi*").toString()).isEqualTo("Tom");
            assertThat(query.get(PEOPLE, "name.l?st").toString()).isEqualTo("Anderson");
            assertThat(query.get(PEOPLE, "chi*.0").toString()).isEqualTo("Sara");
        }

        @Test
        void escapedSeparatorIsPartOfTheKey() {
            assertThat(query.get(PEOPLE, "fav\\.movie").toString()).isEqualTo("Deer Hunter");
        }

        @Test
        void numericSegmentIsAKeyInObjects() {
            assertThat(query.get("{\"1\":\"one\",\"0\":\"zero\"}", "1").toString()).isEqualTo("one");
        }

        @Test
        void collectsKeyFromEveryElement() {
            Value firsts = query.get(PEOPLE, "friends.#.first");

            assertThat(firsts.raw()).isEqualTo("[\"Dale\",\"Roger\",\"Jane\"]");
            assertThat(firsts.matchOffsets()).hasSize(3);
        }

        @Test
        void collectSkipsElementsWithoutTheKey() {
            String json = "[{\"a\":1},{\"b\":2},{\"a\":3}]";

            assertThat(query.get(json, "#.a").raw()).isEqualTo("[1,3]");
        }

        @Test
        void nestedCounts() {
            assertThat(query.get(PEOPLE, "friends.#.nets.#").raw()).isEqualTo("[3,2,2]");
        }

        @Test
        void emptyArrayCountsZero() {
            assertThat(query.get("{\"a\":[]}", "a.#").asLong()).isZero();
            assertThat(query.get("{\"a\":[ ]}", "a.#").exists()).isTrue();
        }
    }

    @Nested
    @DisplayName("queries")
    class Queries {

        @Test
        void firstMatch() {
            assertThat(query.get(PEOPLE, "friends.#(last==\"Murphy\").first").toString()).isEqualTo("Dale");
            assertThat(query.get(PEOPLE, "friends.#(last=\"Murphy\").first").toString()).isEqualTo("Dale");
        }

        @Test
        void allMatches() {
            assertThat(query.get(PEOPLE, "friends.#(last==\"Murphy\")#.first").raw())
                    .isEqualTo("[\"Dale\",\"Jane\"]");
            assertThat(query.get(PEOPLE, "friends.#(age>45)#.last").raw()).isEqualTo("[\"Craig\",\"Murphy\"]");
        }

        @Test
        void wildcardOperators() {
            assertThat(query.get(PEOPLE, "friends.#(first%\"D*\").last").toString()).isEqualTo("Murphy");
            assertThat(query.get(PEOPLE, "friends.#(first!%\"D*\").last").toString()).isEqualTo("Craig");
        }

        @Test
        void bracketFormIsASynonym() {
            assertThat(query.get(PEOPLE, "friends.#[age<45].first").toString()).isEqualTo("Dale");
        }

        @Test
        void nestedQuery() {
            assertThat(query.get(PEOPLE, "friends.#(nets.#(==\"fb\"))#.first").raw())
                    .isEqualTo("[\"Dale\",\"Roger\"]");
        }

        @Test
        void scalarElementsMatchOnlyWithAnEmptyKey() {
            assertThat(query.get(PEOPLE, "children.#(==\"Alex\")").toString()).isEqualTo("Alex");
            assertThat(query.get(PEOPLE, "children.#(name==\"Alex\")").exists()).isFalse();
            assertThat(query.get("[1,5,7,3]", "#(>4)#").raw()).isEqualTo("[5,7]");
        }

        @Test
        void existenceCheckWithoutOperator() {
            String json = "[{\"a\":1},{\"b\":2},{\"a\":null}]";

            assertThat(query.get(json, "#(a)#").raw()).isEqualTo("[{\"a\":1},{\"a\":null}]");
        }

        @Test
        void noMatchGivesEmptyArrayOrNothing() {
            Value all = query.get(DOC, "a.#(n>5)#");
            Value first = query.get(DOC, "a.#(n>5)");

            assertThat(all.exists()).isTrue();
            assertThat(all.raw()).isEqualTo("[]");
            assertThat(first.exists()).isFalse();
        }

        @Test
        void tildeOperands() {
            String json = "[{\"a\":1,\"b\":true},{\"a\":2,\"b\":false},{\"a\":3,\"b\":\"true\"},"
                    + "{\"a\":4,\"b\":0},{\"a\":5,\"b\":null}]";

            assertThat(query.get(json, "#(b==~true)#.a").raw()).isEqualTo("[1,3]");
            assertThat(query.get(json, "#(b==~false)#.a").raw()).isEqualTo("[2,4,5]");
            assertThat(query.get(json, "#(b==~null)#.a").raw()).isEqualTo("[5]");
            assertThat(query.get(json, "#(b==~*)#.a").raw()).isEqualTo("[1,2,3,4,5]");
            assertThat(query.get(json, "#(b==~maybe)#.a").raw()).isEqualTo("[]");
        }

        @Test
        void booleanComparisons() {
            String json = "[{\"id\":1,\"ok\":true},{\"id\":2,\"ok\":false}]";

            assertThat(query.get(json, "#(ok==true).id").asInt()).isEqualTo(1);
            assertThat(query.get(json, "#(ok!=true).id").asInt()).isEqualTo(2);
            assertThat(query.get(json, "#(ok<true)#.id").raw()).isEqualTo("[2]");
        }

        @Test
        void unbalancedQueryMatchesNothing() {
            assertThat(query.get(DOC, "a.#(n>1").exists()).isFalse();
        }

        @Test
        void pipeAfterAllMatchesSplitsOnce() {
            assertThat(query.get(PEOPLE, "friends.#(age>45)#.first|1").toString()).isEqualTo("Jane");
            assertThat(query.get(PEOPLE, "friends.#(age>45)#.first|#").asInt()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("multi-selectors and literals")
    class MultiSelectors {

        @Test
        void arraySelector() {
            assertThat(query.get(PEOPLE, "[name.first,age,children.0]").raw()).isEqualTo("[\"Tom\",37,\"Sara\"]");
        }

        @Test
        void objectSelectorNamesItems() {
            assertThat(query.get(PEOPLE, "{name.first,age,\"kids\":children.#}").raw())
                    .isEqualTo("{\"first\":\"Tom\",\"age\":37,\"kids\":3}");
        }

        @Test
        void bareNamesAreEncoded() {
            assertThat(query.get(PEOPLE, "{given:name.first}").raw()).isEqualTo("{\"given\":\"Tom\"}");
        }

        @Test
        void missingItemsAreLeftOut() {
            assertThat(query.get(PEOPLE, "{name.first,nope}").raw()).isEqualTo("{\"first\":\"Tom\"}");
            assertThat(query.get(PEOPLE, "[nope]").raw()).isEqualTo("[]");
        }

        @Test
        void unnamedItemWithComplexPathIsUnderscore() {
            assertThat(query.get(PEOPLE, "{children.#(==\"Alex\")}").raw()).isEqualTo("{\"_\":\"Alex\"}");
        }

        @Test
        void pathAfterSelectorAppliesToTheBuiltValue() {
            assertThat(query.get(PEOPLE, "{age,children}.children.1").toString()).isEqualTo("Alex");
            assertThat(query.get(PEOPLE, "[age,name.first]|1").toString()).isEqualTo("Tom");
        }

        @Test
        void selectorAfterKeyRunsOnThatValue() {
            assertThat(query.get(PEOPLE, "name.[last,first]").raw()).isEqualTo("[\"Anderson\",\"Tom\"]");
        }

        @Test
        void literals() {
            assertThat(query.get(PEOPLE, "{name.first,\"active\":!true,\"score\":!3.5,\"tags\":![1,2]}").raw())
                    .isEqualTo("{\"first\":\"Tom\",\"active\":true,\"score\":3.5,\"tags\":[1,2]}");
            assertThat(query.get(PEOPLE, "!\"hi\"").toString()).isEqualTo("hi");
            assertThat(query.get(PEOPLE, "!NULL").kind()).isEqualTo(Kind.NULL);
        }

        @Test
        void unknownLiteralFallsThroughToKeyLookup() {
            assertThat(query.get("{\"!x\":1}", "!x").asInt()).isEqualTo(1);
        }

        @Test
        void synthesizedValuesHaveNoOrigin() {
            Value built = query.get(PEOPLE, "[name.first,age]");

            assertThat(built.origin()).isZero();
            assertThat(built.hasOrigin()).isFalse();
        }
    }

    @Nested
    @DisplayName("modifiers")
    class Modifiers {

        @Test
        void modifierOnWholeDocument() {
            assertThat(query.get("[1,2,3]", "@reverse").raw()).isEqualTo("[3,2,1]");
            assertThat(query.get(" {\"a\" : 1} ", "@ugly").raw()).isEqualTo("{\"a\":1}");
        }

        @Test
        void modifierChain() {
            assertThat(query.get(PEOPLE, "children|@reverse|0").toString()).isEqualTo("Jack");
            assertThat(query.get(PEOPLE, "children.@reverse.0").toString()).isEqualTo("Jack");
            assertThat(query.get(PEOPLE, "name|@keys").raw()).isEqualTo("[\"first\",\"last\"]");
        }

        @Test
        void modifierWithArgument() {
            String json = "{\"n\":[1,[2],[3,4],[5,[6,7]]]}";

            assertThat(query.get(json, "n|@flatten").raw()).isEqualTo("[1,2,3,4,5,[6,7]]");
            assertThat(query.get(json, "n|@flatten:{\"deep\":true}").raw()).isEqualTo("[1,2,3,4,5,6,7]");
        }

        @Test
        void modifierOutputIsAFreshRoot() {
            Value reversed = query.get(PEOPLE, "children|@reverse|0");

            assertThat(reversed.hasOrigin()).isFalse();
            assertThat(query.path(reversed, PEOPLE)).isEmpty();
        }

        @Test
        void stringRoundTrip() {
            String json = "{\"s\":\"{\\\"a\\\":1}\"}";

            assertThat(query.get(json, "s|@fromstr").raw()).isEqualTo("{\"a\":1}");
            assertThat(query.get(json, "s|@fromstr|a").asInt()).isEqualTo(1);
            assertThat(query.get("{\"a\":1}", "@tostr").toString()).isEqualTo("{\"a\":1}");
        }

        @Test
        void validGateEndsTheChainOnBadInput() {
            assertThat(query.get("{\"a\":1", "@valid").exists()).isFalse();
            assertThat(query.get("{\"a\":1}", "@valid.a").asInt()).isEqualTo(1);
        }

        @Test
        void unknownModifierPassesValueThrough() {
            assertThat(query.get(PEOPLE, "children|@nope|1").toString()).isEqualTo("Alex");
        }

        @Test
        void searchAndDig() {
            String json = "{\"a\":{\"b\":{\"name\":\"x\"},\"c\":[{\"name\":\"y\"}]}}";

            assertThat(query.get(json, "@dig:name").raw()).isEqualTo("[\"x\",\"y\"]");
            assertThat(query.get(json, "@search:a.b.name").toString()).isEqualTo("x");
        }

        @Test
        void customModifier() {
            var engine = JsonQuery.create(ModifierRegistry.withBuiltins(), QueryOptions.DEFAULT);
            engine.registerModifier("wrap", (json, arg) -> "{\"" + arg + "\":" + json + "}");

            assertThat(engine.modifierExists("wrap")).isTrue();
            assertThat(engine.get(DOC, "a.0|@wrap:first").raw()).isEqualTo("{\"first\":{\"n\":1}}");
            assertThat(engine.get(DOC, "a.0|@wrap:first|first.n").asInt()).isEqualTo(1);
            assertThat(query.modifierExists("wrap")).isFalse();
        }
    }

    @Nested
    @DisplayName("JSON Lines")
    class JsonLines {

        private static final String LINES = "{\"name\":\"Gilbert\",\"age\":61}\n"
                + "{\"name\":\"Alexa\",\"age\":34}\n"
                + "{\"name\":\"May\",\"age\":57}\n";

        @Test
        void countsAndIndexesLines() {
            assertThat(query.get(LINES, "..#").asInt()).isEqualTo(3);
            assertThat(query.get(LINES, "..1.name").toString()).isEqualTo("Alexa");
            assertThat(query.get(LINES, "..3").exists()).isFalse();
        }

        @Test
        void broadcastsAndFilters() {
            assertThat(query.get(LINES, "..#.name").raw()).isEqualTo("[\"Gilbert\",\"Alexa\",\"May\"]");
            assertThat(query.get(LINES, "..#(age>50)#.name").raw()).isEqualTo("[\"Gilbert\",\"May\"]");
        }

        @Test
        void forEachLineVisitsTopLevelValues() {
            List<String> names = new ArrayList<>();
            query.forEachLine(LINES, line -> {
                names.add(line.get("name").toString());
                return true;
            });

            assertThat(names).containsExactly("Gilbert", "Alexa", "May");
        }

        @Test
        void forEachLineStopsWhenCallbackReturnsFalse() {
            List<Value> seen = new ArrayList<>();
            query.forEachLine(LINES, line -> {
                seen.add(line);
                return false;
            });

            assertThat(seen).hasSize(1);
            assertThat(seen.get(0).origin()).isZero();
        }

        @Test
        void onlyTheFirstLineIsTraceable() {
            Value names = query.get(LINES, "..#.name");

            assertThat(query.paths(names, LINES)).containsExactly("name", "", "");
        }

        @Test
        void lineValuesCarryTheirOffsets() {
            List<Integer> origins = new ArrayList<>();
            query.forEachLine(LINES, line -> origins.add(line.origin()));

            assertThat(origins).hasSize(3);
            for (int n = 0; n < origins.size(); n++) {
                assertThat(LINES.charAt(origins.get(n))).isEqualTo('{');
            }
        }
    }

    @Nested
    @DisplayName("options")
    class Options {

        private final JsonQuery plain = JsonQuery.create(
                ModifierRegistry.withBuiltins(),
                QueryOptions.builder().disableModifiers(true).build());

        @Test
        void disabledModifiersMakeAtAnOrdinaryKey() {
            String json = "{\"@meta\":{\"v\":1},\"a\":[1,2]}";

            assertThat(plain.get(json, "@meta.v").asInt()).isEqualTo(1);
            assertThat(query.get(json, "@meta.v").exists()).isFalse();
        }

        @Test
        void disabledModifiersHaveNoRootPath() {
            Value root = plain.parse(DOC);

            assertThat(plain.path(root, DOC)).isEmpty();
            assertThat(query.path(query.parse(DOC), DOC)).isEqualTo("@this");
        }

        @Test
        void wildcardLimitAppliesToKeyPatterns() {
            var strict = JsonQuery.create(
                    ModifierRegistry.withBuiltins(),
                    QueryOptions.builder().wildcardComplexityLimit(1).build());
            String json = "{\"abcdefghij\":1}";

            assertThat(query.get(json, "*c*e*g*i*").asInt()).isEqualTo(1);
            assertThat(strict.get(json, "*c*e*g*i*").exists()).isFalse();
        }
    }

    @Nested
    @DisplayName("provenance")
    class Provenance {

        @Test
        void pathOfNestedValue() {
            Value n = query.get(DOC, "a.1.n");

            assertThat(query.path(n, DOC)).isEqualTo("a.1.n");
        }

        @Test
        void pathOfQueryResult() {
            Value murphy = query.get(PEOPLE, "friends.#(last==\"Murphy\")");

            assertThat(query.path(murphy, PEOPLE)).isEqualTo("friends.0");
        }

        @Test
        void pathEscapesUnsafeKeyCharacters() {
            Value movie = query.get(PEOPLE, "fav\\.movie");

            assertThat(query.path(movie, PEOPLE)).isEqualTo("fav\\.movie");
        }

        @Test
        void pathsOfAllMatches() {
            Value names = query.get(PEOPLE, "friends.#(last==\"Murphy\")#.first");

            assertThat(query.paths(names, PEOPLE)).containsExactly("friends.0.first", "friends.2.first");
        }

        @Test
        void pathsOfCollectedKeys() {
            Value ns = query.get(DOC, "a.#.n");

            assertThat(query.paths(ns, DOC)).containsExactly("a.0.n", "a.1.n", "a.2.n");
        }

        @Test
        void pathFailsAgainstAnotherDocument() {
            Value n = query.get(DOC, "a.1.n");

            assertThat(query.path(n, "{\"b\":0}")).isEmpty();
            assertThat(query.paths(query.get(DOC, "a.#"), DOC)).isEmpty();
        }

        @Test
        void nestedGetKeepsDocumentOffsets() {
            Value second = query.get(DOC, "a.1");
            Value n = second.get("n");

            assertThat(DOC.startsWith(n.raw(), n.origin())).isTrue();
            assertThat(query.path(n, DOC)).isEqualTo("a.1.n");
        }
    }

    @Nested
    @DisplayName("properties")
    class Properties {

        @Test
        @DisplayName("raw spans of scalar results are the document text at their origin")
        void rawRoundTrip() {
            for (String path : List.of("name.first", "age", "children.2", "friends.1.age", "friends.2.nets.0")) {
                Value value = query.get(PEOPLE, path);

                assertThat(value.exists()).as(path).isTrue();
                assertThat(PEOPLE.substring(value.origin(), value.origin() + value.raw().length()))
                        .as(path)
                        .isEqualTo(value.raw());
            }
        }

        @Test
        @DisplayName("minify is idempotent and undoes pretty")
        void minifyIdempotence() {
            String once = query.get(PEOPLE, "@ugly").raw();

            assertThat(query.get(once, "@ugly").raw()).isEqualTo(once);
            assertThat(query.get(query.get(PEOPLE, "@pretty").raw(), "@ugly").raw()).isEqualTo(once);
        }

        @Test
        @DisplayName("array count equals the number of broadcast elements")
        void arrayLengthInvariant() {
            for (String path : List.of("children", "friends", "friends.0.nets", "a")) {
                String doc = path.equals("a") ? DOC : PEOPLE;

                assertThat(query.get(doc, path + ".#").asInt())
                        .as(path)
                        .isEqualTo(query.get(doc, path).array().size());
            }
        }

        @Test
        @DisplayName("= and != partition the elements")
        void predicateSymmetry() {
            List<Value> equal = query.get(PEOPLE, "friends.#(last==\"Murphy\")#").array();
            List<Value> notEqual = query.get(PEOPLE, "friends.#(last!=\"Murphy\")#").array();

            assertThat(equal.size() + notEqual.size()).isEqualTo(query.get(PEOPLE, "friends.#").asInt());
            assertThat(equal).doesNotContainAnyElementsOf(notEqual);
        }

        @Test
        @DisplayName("match offsets align with the result elements")
        void multiMatchCount() {
            Value matches = query.get(PEOPLE, "friends.#(age>40)#.nets");

            assertThat(matches.matchOffsets()).hasSameSizeAs(matches.array());
        }
    }

    @Nested
    @DisplayName("robustness")
    class Robustness {

        @Test
        void malformedDocumentsNeverThrow() {
            assertThat(query.get("", "a").exists()).isFalse();
            assertThat(query.get("not json", "a").exists()).isFalse();
            assertThat(query.get("{\"a\":", "a").exists()).isFalse();
            assertThat(query.get("{\"a\":\"open", "a").exists()).isFalse();
            assertThat(query.get("{\"a\":[1,2", "a.1").asInt()).isEqualTo(2);
            assertThat(query.get("[[[[", "0.0.0").exists()).isFalse();
        }

        @Test
        void truncatedCompositesDoNotExist() {
            assertThat(query.get("{\"a\":{\"b\":1", "a").exists()).isFalse();
            assertThat(query.get("{\"a\":[1,2", "a").exists()).isFalse();
            assertThat(query.get("[1,{\"b\":2", "1").exists()).isFalse();
            assertThat(query.get("[1,[2", "#").asInt()).isEqualTo(1);
        }

        @Test
        void deeplyNestedArraysPrettyPrint() {
            String deep = nestedArrays(100_000, "");

            Value pretty = query.get(deep, "@pretty:{\"indent\":\"\"}");

            assertThat(pretty.exists()).isTrue();
            assertThat(JsonFormatter.ugly(pretty.raw())).isEqualTo(deep);
        }

        @Test
        void deeplyNestedObjectsPrettyPrint() {
            String deep = "{\"a\":".repeat(100_000) + "1" + "}".repeat(100_000);

            Value pretty = query.get(deep, "@pretty:{\"indent\":\"\"}");

            assertThat(JsonFormatter.ugly(pretty.raw())).isEqualTo(deep);
        }

        @Test
        void deeplyNestedMemberPipedIntoPretty() {
            String deep = nestedArrays(100_000, "");

            Value pretty = query.get("{\"a\":" + deep + "}", "a|@pretty:{\"indent\":\"\"}");

            assertThat(JsonFormatter.ugly(pretty.raw())).isEqualTo(deep);
        }

        @Test
        void deeplyNestedArraysFlattenAndDig() {
            String deep = nestedArrays(10_000, "{\"x\":1}");

            assertThat(query.get(deep, "@flatten:{\"deep\":true}").raw()).isEqualTo("[{\"x\":1}]");
            assertThat(query.get(deep, "@dig:x").raw()).isEqualTo("[1]");
        }

        @Test
        void deeplyNestedTreeConvertsToJackson() {
            JsonNode node = query.get(nestedArrays(100_000, "7"), "@this").toJsonNode();

            int depth = 0;
            while (node.isArray() && node.size() == 1) {
                node = node.get(0);
                depth++;
            }
            assertThat(depth).isEqualTo(100_000);
            assertThat(node.asInt()).isEqualTo(7);
        }

        @Test
        void modifierExhaustingTheStackYieldsNothing() {
            ModifierRegistry registry = ModifierRegistry.withBuiltins();
            registry.register("bottomless", (json, arg) -> {
                throw new StackOverflowError();
            });

            Value result = JsonQuery.create(registry, QueryOptions.DEFAULT).get("[1]", "@bottomless");

            assertThat(result.exists()).isFalse();
        }

        @Test
        void malformedPathsNeverThrow() {
            for (String path : List.of("", ".", "..", "#", "#(", "[", "{", "@", "!", "a.#(b", "a|", "\\")) {
                query.get(DOC, path);
                query.get(PEOPLE, path);
            }
        }

        @Test
        void emptyPathFindsNothing() {
            assertThat(query.get(DOC, "").exists()).isFalse();
        }

        private String nestedArrays(int depth, String innermost) {
            return "[".repeat(depth) + innermost + "]".repeat(depth);
        }
    }

    @Nested
    @DisplayName("other entry points")
    class EntryPoints {

        @Test
        void getMany() {
            List<Value> values = query.getMany(DOC, "a.#", "a.0.n", "missing");

            assertThat(values).hasSize(3);
            assertThat(values.get(0).asInt()).isEqualTo(3);
            assertThat(values.get(1).asInt()).isEqualTo(1);
            assertThat(values.get(2).exists()).isFalse();
        }

        @Test
        void getFromBytes() {
            assertThat(query.get(DOC.getBytes(StandardCharsets.UTF_8), "a.2.n").asInt()).isEqualTo(3);
        }

        @Test
        void parseReadsTheFirstValue() {
            assertThat(query.parse("  [1,2]").origin()).isEqualTo(2);
            assertThat(query.parse("  [1,2]").isArray()).isTrue();
            assertThat(query.parse("42").asInt()).isEqualTo(42);
            assertThat(query.parse("%").exists()).isFalse();
        }

        @Test
        void isValid() {
            assertThat(query.isValid(DOC)).isTrue();
            assertThat(query.isValid("{\"a\":1,}")).isFalse();
            assertThat(query.isValid("[1,2]".getBytes(StandardCharsets.UTF_8))).isTrue();
        }
    }
}
