package json.ordered.internal;

import json.ordered.JsonEmbedded;
import json.ordered.JsonField;
import json.ordered.OrderedJsonTestBase;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

public class FieldResolverTest extends OrderedJsonTestBase {

    private static List<String> names(Class<?> type) {
        return FieldResolver.plan(type).fields().stream().map(PlannedField::name).toList();
    }

    public static class Leaf {
        public int b1;
        public int b2;
    }

    public static class Flat {
        public int a;
        @JsonEmbedded
        public Leaf leaf;
        public int z;
    }

    @Test
    void embeddedFieldsTakeThePlaceOfTheirHolder() {
        assertThat(names(Flat.class)).containsExactly("a", "b1", "b2", "z");
        final PlannedField b2 = FieldResolver.plan(Flat.class).lookup("b2");
        assertThat(b2.depth()).isEqualTo(2);
        assertThat(b2.path()).extracting(java.lang.reflect.Field::getName).containsExactly("leaf", "b2");
    }

    public static class Visibility {
        public int shown;
        int packagePrivate;
        private int hidden;
        public transient int notSaved;
        public static int shared;
        @JsonField(exclude = true)
        public int excluded;
    }

    @Test
    void onlyPublicInstanceFieldsAreMembers() {
        assertThat(names(Visibility.class)).containsExactly("shown");
    }

    private static class Hidden {
        public int inner;
    }

    public static class HoldsHidden {
        @JsonEmbedded
        private Hidden hidden;
        public int own;
    }

    @Test
    void nonPublicEmbeddedAggregatesStillPromoteTheirFields() {
        assertThat(names(HoldsHidden.class)).containsExactly("inner", "own");
    }

    public static class V {
        public int v;
    }

    public static class Twice {
        @JsonEmbedded
        public V first;
        @JsonEmbedded
        public V second;
        public int own;
    }

    @Test
    void typeEmbeddedTwiceAtOneLevelCancelsOut() {
        assertThat(names(Twice.class)).containsExactly("own");
    }

    public static class TaggedN {
        @JsonField("n")
        public int x;
    }

    public static class PlainN {
        public int n;
    }

    public static class Contest {
        @JsonEmbedded
        public PlainN plain;
        @JsonEmbedded
        public TaggedN tagged;
    }

    public static class Tie {
        @JsonEmbedded
        public PlainN left;
        @JsonEmbedded
        public V right;
        @JsonEmbedded
        public OtherPlainN other;
    }

    public static class OtherPlainN {
        public int n;
    }

    public static class Shallow {
        public String n;
        @JsonEmbedded
        public TaggedN deep;
    }

    @Test
    void dominantFieldWinsContestedNames() {
        final FieldPlan contest = FieldResolver.plan(Contest.class);
        assertThat(contest.fields()).hasSize(1);
        assertThat(contest.lookup("n").leaf().getName()).isEqualTo("x");

        assertThat(names(Tie.class)).containsExactly("v");

        final FieldPlan shallow = FieldResolver.plan(Shallow.class);
        assertThat(shallow.fields()).hasSize(1);
        assertThat(shallow.lookup("n").type()).isEqualTo(String.class);
    }

    public static class Base {
        public int id;
        public int base;
    }

    public static class Sub extends Base {
        public int id;
        public int own;
    }

    public abstract static class AbstractBase {
        public String kind;
    }

    public static class Concrete extends AbstractBase {
        public int v;
    }

    @Test
    void superclassFieldsComeFirstAndAreShadowed() {
        assertThat(names(Sub.class)).containsExactly("base", "id", "own");
        assertThat(FieldResolver.plan(Sub.class).lookup("id").leaf().getDeclaringClass()).isEqualTo(Sub.class);
        assertThat(names(Concrete.class)).containsExactly("kind", "v");
    }

    public enum Color { RED }

    public static class WithScalarEmbed {
        @JsonEmbedded
        public Color color;
        @JsonEmbedded
        @JsonField("label")
        public Leaf renamed;
    }

    @Test
    void nonAggregateOrNamedEmbedsAreSingleMembers() {
        assertThat(names(WithScalarEmbed.class)).containsExactly("Color", "label");
        assertThat(FieldResolver.plan(WithScalarEmbed.class).lookup("label").tagged()).isTrue();
        assertThat(FieldResolver.plan(WithScalarEmbed.class).lookup("Color").tagged()).isFalse();
    }

    public static class Tags {
        @JsonField("a&b")
        public int amp;
        @JsonField("bad,name")
        public int comma;
        @JsonField("x")
        public List<Integer> notQuotable;
        @JsonField(value = "q", string = true)
        public Optional<Long> quotable;
        @JsonField(value = "l", string = true)
        public List<Long> listIgnoresString;
        @JsonField(value = "a<b")
        public int angle;
    }

    @Test
    void tagNamesAndOptions() {
        assertThat(names(Tags.class)).containsExactly("a&b", "comma", "x", "q", "l", "a<b");
        final FieldPlan plan = FieldResolver.plan(Tags.class);
        assertThat(plan.lookup("q").quoted()).isTrue();
        assertThat(plan.lookup("l").quoted()).isFalse();
        assertThat(text(plan.lookup("a<b").keyBytes(true))).isEqualTo("\"a\\u003Cb\":");
        assertThat(text(plan.lookup("a<b").keyBytes(false))).isEqualTo("\"a<b\":");
        assertThat(text(plan.lookup("a&b").keyBytes(true))).isEqualTo("\"a\\u0026b\":");
    }

    @Test
    void validNames() {
        assertThat(FieldResolver.isValidName("a&b")).isTrue();
        assertThat(FieldResolver.isValidName("-_.:/ ok")).isTrue();
        assertThat(FieldResolver.isValidName("stra" + (char) 0xDF + "e")).isTrue();
        assertThat(FieldResolver.isValidName("")).isFalse();
        assertThat(FieldResolver.isValidName("a,b")).isFalse();
        assertThat(FieldResolver.isValidName("a\"b")).isFalse();
        assertThat(FieldResolver.isValidName("a\\b")).isFalse();
    }

    public static class Cased {
        public int value;
        @JsonField("VALUE")
        public int upper;
        public int other;
    }

    @Test
    void lookupTriesExactNameFirst() {
        final FieldPlan plan = FieldResolver.plan(Cased.class);
        assertThat(plan.lookup("VALUE").leaf().getName()).isEqualTo("upper");
        assertThat(plan.lookup("value").leaf().getName()).isEqualTo("value");
        assertThat(plan.lookup("Value").leaf().getName()).isEqualTo("value");
        assertThat(plan.lookup("OTHER").leaf().getName()).isEqualTo("other");
        assertThat(plan.lookup("missing")).isNull();
    }

    public record Point(int x, @JsonField("why") int y) {
    }

    @Test
    void recordComponentsAreAlwaysMembers() {
        assertThat(names(Point.class)).containsExactly("x", "why");
    }

    @Test
    void plansAreBuiltOnce() {
        assertThat(FieldResolver.plan(Flat.class)).isSameAs(FieldResolver.plan(Flat.class));
    }
}
