package com.quill.content.api;

import com.quill.content.domain.PostPatch;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Post changes. Absent and null fields are left unchanged.
 */
public record UpdatePostRequest(
        @Size(max = InputRules.TITLE_MAX)
                @Pattern(regexp = InputRules.NOT_BLANK, message = InputRules.NOT_BLANK_MESSAGE)
                String title,
        @Size(max = InputRules.BODY_MAX)
                @Pattern(regexp = InputRules.NOT_BLANK, message = InputRules.NOT_BLANK_MESSAGE)
                String body) {

    PostPatch toPatch() {
        return new PostPatch(title, body);
    }
}
