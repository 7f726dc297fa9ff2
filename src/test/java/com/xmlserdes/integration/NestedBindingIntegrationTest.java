package com.xmlserdes.integration;

import com.xmlserdes.XmlSerDes;
import com.xmlserdes.binding.XmlBinding;
import com.xmlserdes.error.MissingAttributeException;
import com.xmlserdes.error.TextParseException;
import com.xmlserdes.schema.FieldSpec;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests for bindings nested three levels deep.
 */
class NestedBindingIntegrationTest {

    enum RoomType { KITCHEN, BEDROOM, STUDY }

    record Item(String name, double width) {
        static final XmlBinding<Item> XML = XmlBinding.builder(Item.class)
                .field("@name", String.class, Item::name)
                .field("width", double.class, Item::width)
                .factory(v -> new Item(v.get("name", String.class), v.get("width", Double.class)))
                .build();
    }

    record Room(RoomType type, int floor, List<Item> items) {
        static final XmlBinding<Room> XML = XmlBinding.builder(Room.class)
                .field("@type", RoomType.class, Room::type)
                .field("floor", int.class, Room::floor)
                .field(FieldSpec.of("items", List.of(Item.class)), Room::items)
                .factory(v -> new Room(v.get("type", RoomType.class), v.get("floor", Integer.class),
                        v.getList("items", Item.class)))
                .build();
    }

    record Building(String address, Room lobby, List<Room> rooms) {
        static final XmlBinding<Building> XML = XmlBinding.builder(Building.class)
                .field("@address", String.class, Building::address)
                .field("lobby", Room.class, Building::lobby)
                .field(FieldSpec.of("rooms", List.of(Room.class)), Building::rooms)
                .factory(v -> new Building(v.get("address", String.class), v.get("lobby", Room.class),
                        v.getList("rooms", Room.class)))
                .build();
    }

    private final XmlSerDes serdes = XmlSerDes.defaults();

    private static Building sample() {
        Room lobby = new Room(RoomType.STUDY, 0, List.of());
        Room kitchen = new Room(RoomType.KITCHEN, 0, List.of(new Item("table", 1.2), new Item("stool", 0.4)));
        Room bedroom = new Room(RoomType.BEDROOM, 1, List.of(new Item("bed", 1.6)));
        return new Building("1 High Street", lobby, List.of(kitchen, bedroom));
    }

    @Test
    void testThreeLevelRoundTrip() {
        Building building = sample();

        String xml = serdes.toXmlText(building);

        assertThat(xml).isEqualTo("<building address=\"1 High Street\">"
                + "<lobby type=\"STUDY\"><floor>0</floor><items /></lobby>"
                + "<rooms>"
                + "<room type=\"KITCHEN\"><floor>0</floor><items>"
                + "<item name=\"table\"><width>1.2</width></item>"
                + "<item name=\"stool\"><width>0.4</width></item>"
                + "</items></room>"
                + "<room type=\"BEDROOM\"><floor>1</floor><items>"
                + "<item name=\"bed\"><width>1.6</width></item>"
                + "</items></room>"
                + "</rooms></building>");
        assertThat(serdes.fromXmlText(Building.class, xml)).isEqualTo(building);
    }

    @Test
    void testNestedErrorCarriesXpath() {
        String xml = "<building address=\"x\"><lobby type=\"STUDY\"><floor>0</floor></lobby><rooms>"
                + "<room type=\"KITCHEN\"><floor>0</floor></room>"
                + "<room><floor>1</floor></room>"
                + "</rooms></building>";

        assertThatThrownBy(() -> serdes.fromXmlText(Building.class, xml))
                .isInstanceOfSatisfying(MissingAttributeException.class, e -> {
                    assertThat(e.getAttributeName()).isEqualTo("type");
                    assertThat(e.getPath()).hasToString("/building/rooms/room[2]/@type");
                });
    }

    @Test
    void testDeepParseErrorCarriesXpath() {
        String xml = "<building address=\"x\"><lobby type=\"STUDY\"><floor>0</floor></lobby><rooms>"
                + "<room type=\"KITCHEN\"><floor>0</floor><items>"
                + "<item name=\"a\"><width>1</width></item><item name=\"b\"><width>wide</width></item>"
                + "</items></room></rooms></building>";

        assertThatThrownBy(() -> serdes.fromXmlText(Building.class, xml))
                .isInstanceOf(TextParseException.class)
                .hasMessageEndingWith(" at /building/rooms/room[1]/items/item[2]/width");
    }

    @Test
    void testUnknownEnumConstant() {
        String xml = "<building address=\"x\"><lobby type=\"GARAGE\"><floor>0</floor></lobby></building>";

        assertThatThrownBy(() -> serdes.fromXmlText(Building.class, xml))
                .isInstanceOf(TextParseException.class)
                .hasMessageContaining("not a member of enumeration RoomType")
                .hasMessageEndingWith(" at /building/lobby/@type");
    }
}
