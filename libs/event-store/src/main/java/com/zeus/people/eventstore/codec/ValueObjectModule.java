package com.zeus.people.eventstore.codec;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.zeus.people.domain.ValidationException;
import com.zeus.people.domain.valueobject.AccessLevel;
import com.zeus.people.domain.valueobject.BldgName;
import com.zeus.people.domain.valueobject.BldgNr;
import com.zeus.people.domain.valueobject.EmpName;
import com.zeus.people.domain.valueobject.EmpNr;
import com.zeus.people.domain.valueobject.ExtNr;
import com.zeus.people.domain.valueobject.MoneyAmt;
import com.zeus.people.domain.valueobject.PhoneNr;
import com.zeus.people.domain.valueobject.Rank;
import com.zeus.people.domain.valueobject.Rating;
import com.zeus.people.domain.valueobject.RoomNr;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.function.Function;

/**
 * Writes each value object as its wrapped primitive and reads it back through the value object's
 * validating factory. A stored value that fails validation fails the read.
 */
public final class ValueObjectModule extends SimpleModule {

    public ValueObjectModule() {
        super("zeus-value-objects");
        text(EmpNr.class, EmpNr::value, EmpNr::of);
        text(EmpName.class, EmpName::value, EmpName::of);
        text(Rank.class, Rank::value, Rank::of);
        text(AccessLevel.class, AccessLevel::value, AccessLevel::of);
        text(PhoneNr.class, PhoneNr::value, PhoneNr::of);
        text(RoomNr.class, RoomNr::value, RoomNr::of);
        text(BldgNr.class, BldgNr::value, BldgNr::of);
        text(BldgName.class, BldgName::value, BldgName::of);
        text(ExtNr.class, ExtNr::value, ExtNr::of);

        addSerializer(MoneyAmt.class, new StdSerializer<>(MoneyAmt.class) {
            @Override
            public void serialize(MoneyAmt amount, JsonGenerator gen, SerializerProvider provider)
                    throws IOException {
                gen.writeNumber(amount.value());
            }
        });
        addDeserializer(MoneyAmt.class, new StdDeserializer<>(MoneyAmt.class) {
            @Override
            public MoneyAmt deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
                if (!p.currentToken().isNumeric()) {
                    return (MoneyAmt) ctxt.handleUnexpectedToken(MoneyAmt.class, p);
                }
                BigDecimal raw = p.getDecimalValue();
                try {
                    return MoneyAmt.of(raw);
                } catch (ValidationException e) {
                    throw InvalidFormatException.from(p, e.getMessage(), raw, MoneyAmt.class);
                }
            }
        });

        addSerializer(Rating.class, new StdSerializer<>(Rating.class) {
            @Override
            public void serialize(Rating rating, JsonGenerator gen, SerializerProvider provider)
                    throws IOException {
                gen.writeNumber(rating.value());
            }
        });
        addDeserializer(Rating.class, new StdDeserializer<>(Rating.class) {
            @Override
            public Rating deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
                if (p.currentToken() != JsonToken.VALUE_NUMBER_INT) {
                    return (Rating) ctxt.handleUnexpectedToken(Rating.class, p);
                }
                int raw = p.getIntValue();
                try {
                    return Rating.of(raw);
                } catch (ValidationException e) {
                    throw InvalidFormatException.from(p, e.getMessage(), raw, Rating.class);
                }
            }
        });
    }

    private <T> void text(Class<T> type, Function<T, String> unwrap, Function<String, T> factory) {
        addSerializer(type, new StdSerializer<>(type) {
            @Override
            public void serialize(T value, JsonGenerator gen, SerializerProvider provider) throws IOException {
                gen.writeString(unwrap.apply(value));
            }
        });
        addDeserializer(type, new StdDeserializer<>(type) {
            @Override
            public T deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
                if (p.currentToken() != JsonToken.VALUE_STRING) {
                    @SuppressWarnings("unchecked")
                    T unexpected = (T) ctxt.handleUnexpectedToken(type, p);
                    return unexpected;
                }
                String raw = p.getText();
                try {
                    return factory.apply(raw);
                } catch (ValidationException e) {
                    throw InvalidFormatException.from(p, e.getMessage(), raw, type);
                }
            }
        });
    }
}
