package com.themixednuts.typeschema.testtypes;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.themixednuts.typeschema.annotation.DefaultValue;
import com.themixednuts.typeschema.annotation.Description;
import com.themixednuts.typeschema.annotation.EnumValues;
import com.themixednuts.typeschema.annotation.Extensions;
import com.themixednuts.typeschema.annotation.MaxLength;
import com.themixednuts.typeschema.annotation.Maximum;
import com.themixednuts.typeschema.annotation.MinLength;
import com.themixednuts.typeschema.annotation.MultipleOf;
import com.themixednuts.typeschema.annotation.Required;
import com.themixednuts.typeschema.annotation.Title;

import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.UUID;

/**
 * Shared fixtures for generator tests.
 */
public final class SampleTypes {

    private SampleTypes() {
    }

    public static class Basic {
        @JsonIgnore
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        public String omitted;
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        public boolean bool;
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        public int integer;
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        public byte integer8;
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        public short integer16;
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        public Integer integer32;
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        public long integer64;
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        public BigInteger bigInteger;
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        public String string;
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        public byte[] bytes;
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        public float float32;
        public double float64;
        @Required
        public Object anything;
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        public Instant timestamp;
    }

    public static class Slices {
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        public List<String> slice;
        @Required
        public List<Object> sliceOfObjects;
    }

    public static class NestedSlice {
        @JsonProperty("slice")
        public List<Element> slice;

        public static class Element {
            @Required
            public String foo;
        }
    }

    public static class GrandParent {
        public Parent child;
    }

    public static class Parent {
        public String name;
        public Child child;
    }

    public static class Child {
        @Required
        public String foo;
    }

    public static class Maps {
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        public Map<String, String> maps;
        public Map<String, Object> mapOfObjects;
        public Map<String, Instant> mapOfTimes;
        public Map<String, Item> mapOfItems;
        public Map<String, Optional<String>> mapOfOptionals;
    }

    public static class SliceOfItems {
        public List<Item> items;
        public Item[] itemArray;
        public List<Optional<Item>> optionalItems;
    }

    public static class Item {
        @Required
        public String foo;
    }

    public enum Color {
        RED,
        @JsonProperty("dark-green")
        GREEN,
        BLUE
    }

    public static class Formats {
        public LocalDate day;
        public UUID id;
        public java.net.URI link;
        public Color color;
        public Optional<Color> maybeColor;
        public Optional<Instant> maybeTime;
        public OptionalInt maybeCount;
        public Set<UUID> ids;
        public JsonNode raw;
        public CharSequence text;
    }

    public static class Nullables {
        @Required
        @MaxLength("5")
        public Optional<String> nickname;
        @Required
        @JsonInclude(JsonInclude.Include.NON_ABSENT)
        public Optional<Integer> age;
        public Optional<Item> item;
    }

    public static class NullableDefault {
        @DefaultValue("abc")
        public Optional<String> nickname;
    }

    public static class Defaults {
        @DefaultValue("hello")
        public String greeting;
        @DefaultValue("")
        public String blank;
        @DefaultValue("2.5")
        public double ratio;
        @DefaultValue("7")
        public int count;
        @DefaultValue("T")
        public boolean enabled;
        @DefaultValue("False")
        public Boolean disabled;
    }

    public static class BadNumericDefault {
        @DefaultValue("many")
        public int count;
    }

    public static class BadBooleanDefault {
        @DefaultValue("yes")
        public boolean flag;
    }

    public static class ObjectDefault {
        @DefaultValue("{}")
        public Item item;
    }

    public static class ArrayDefault {
        @DefaultValue("[]")
        public List<String> values;
    }

    public static class LenientValidators {
        @MinLength("three")
        @MaxLength("10")
        public String name;
        @Maximum("lots")
        @MultipleOf("0.5")
        public double amount;
        @MinLength("3")
        public int notAString;
        @Maximum("9")
        public String notANumber;
    }

    public static class WithExtensions {
        @Extensions("{\"x-order\": 1, \"type\": \"custom\", \"nested\": {\"a\": [1, 2]}}")
        public String tagged;
        @Extensions("{}")
        public int untouched;
    }

    public static class EnumNames {
        @EnumValues("a|b|c")
        @Extensions("{\"enumNames\": [\"A\", \"B\", \"C\"]}")
        public String letter;
    }

    public static class TrailingExtensions {
        @Extensions("{\"x\": 1} garbage")
        public String field;
    }

    public static class BadExtensions {
        @Extensions("{not json")
        public String field;
    }

    public static class ArrayExtensions {
        @Extensions("[1, 2]")
        public String field;
    }

    public static class WrapsBadDefault {
        public BadNumericDefault inner;
    }

    @Title("Annotated")
    @Description("Class-level metadata.")
    @Extensions("{\"x-kind\": \"record\"}")
    public record Point(@Required int x, @Required int y, @JsonProperty("label") String name) {
    }

    public static class Visibility {
        public String shown;
        @JsonProperty("renamed")
        private String hidden;
        @Description("Object level description.")
        @Required
        private String metadata;
        public transient String transientField;
        @JsonProperty("-")
        public String dashed;
        public static String constant = "x";
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class OmitAll {
        @Required
        public String a;
        @Required
        @JsonInclude(JsonInclude.Include.ALWAYS)
        public String b;
    }

    public static class Base {
        public String id;
    }

    public static class Derived extends Base {
        public String label;
    }

    public static class Page<T> {
        public List<T> items;
        public T first;
        public int total;
    }

    public static class Node {
        public String value;
        public Node next;
        public List<Node> children;
    }

    public static class DataNote {
        @JsonProperty("data")
        @Description("The payload.")
        @MinLength("1")
        public String data;
        @JsonProperty("note")
        @Title("Note")
        @DefaultValue("n/a")
        public String note;
    }
}
