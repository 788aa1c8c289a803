package dev.etfaggregator.store;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.msgpack.jackson.dataformat.MessagePackFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;

/**
 * Jackson-backed encoder for segment bodies and manifests.
 * <p>
 * Decimals are written as strings in every format so that their scale survives a round trip;
 * MessagePack would otherwise narrow them to doubles.
 */
public class RecordSerializer {

    private final ObjectMapper jsonMapper;
    private final ObjectMapper msgpackMapper;

    RecordSerializer(ObjectMapper jsonMapper, ObjectMapper msgpackMapper) {
        this.jsonMapper = jsonMapper;
        this.msgpackMapper = msgpackMapper;
    }

    public static RecordSerializer create() {
        return new RecordSerializer(configure(new ObjectMapper()), configure(new ObjectMapper(new MessagePackFactory())));
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.configOverride(BigDecimal.class)
                .setFormat(JsonFormat.Value.forShape(JsonFormat.Shape.STRING));
        return mapper;
    }

    public byte[] writeArray(List<?> records, SerializationFormat format) throws IOException {
        return mapperFor(format).writeValueAsBytes(records);
    }

    public byte[] writeElement(Object record, SerializationFormat format) throws IOException {
        return mapperFor(format).writeValueAsBytes(record);
    }

    public <T> List<T> readArray(byte[] bytes, Class<T> type, SerializationFormat format) throws IOException {
        ObjectMapper mapper = mapperFor(format);
        JavaType listType = mapper.getTypeFactory().constructCollectionType(List.class, type);
        return mapper.readValue(bytes, listType);
    }

    public byte[] writeManifest(DatasetManifest manifest) throws IOException {
        return jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(manifest);
    }

    public DatasetManifest readManifest(byte[] bytes) throws IOException {
        return jsonMapper.readValue(bytes, DatasetManifest.class);
    }

    private ObjectMapper mapperFor(SerializationFormat format) {
        return format == SerializationFormat.MSGPACK ? msgpackMapper : jsonMapper;
    }
}
