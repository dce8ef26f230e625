package com.example.realtime.gateway.mapper;

import com.example.realtime.gateway.dto.PostPayload;
import com.example.realtime.shared.model.Post;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.OffsetDateTime;
import java.util.Map;

@Mapper(componentModel = "spring")
@Slf4j
public abstract class PostPayloadMapper {

    private static final TypeReference<Map<String, Object>> REACTIONS_TYPE = new TypeReference<>() {};

    @Autowired
    protected ObjectMapper objectMapper;

    @Mapping(source = "post.postId", target = "id")
    @Mapping(source = "authorName", target = "authorName")
    @Mapping(source = "post.createdAt", target = "createdAt", qualifiedByName = "isoInstant")
    @Mapping(source = "post.updatedAt", target = "updatedAt", qualifiedByName = "isoInstant")
    @Mapping(source = "post.reactions", target = "reactions", qualifiedByName = "reactionCounts")
    public abstract PostPayload toPayload(Post post, String authorName);

    @Named("isoInstant")
    protected String isoInstant(OffsetDateTime dateTime) {
        return dateTime == null ? null : dateTime.toInstant().toString();
    }

    @Named("reactionCounts")
    protected Map<String, Object> reactionCounts(String reactionsJson) {
        if (reactionsJson == null || reactionsJson.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(reactionsJson, REACTIONS_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring malformed reactions column: {}", e.getOriginalMessage());
            return Map.of();
        }
    }
}
