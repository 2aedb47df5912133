package com.quill.content.api;

import com.quill.content.application.AuthoredPost;
import com.quill.content.application.PostService;
import com.quill.security.CallerIdentity;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Post endpoints. Listing and reading are public; writes and {@code /mine} require a caller.
 */
@RestController
@RequestMapping("/api/v1/posts")
public class PostController {

    private final PostService posts;

    public PostController(PostService posts) {
        this.posts = posts;
    }

    @GetMapping
    public ApiResponse<List<PostResponse>> list() {
        return ApiResponse.of("Posts retrieved", toResponses(posts.list()));
    }

    @GetMapping("/mine")
    public ApiResponse<List<PostResponse>> mine(CallerIdentity caller) {
        return ApiResponse.of(
                "Your posts retrieved", toResponses(posts.listByOwner(caller, caller.userId())));
    }

    @GetMapping("/{id}")
    public ApiResponse<PostResponse> get(@PathVariable UUID id) {
        return ApiResponse.of("Post retrieved", PostResponse.from(posts.get(id)));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<PostResponse> create(
            CallerIdentity caller, @Valid @RequestBody CreatePostRequest request) {
        var post = posts.create(caller, request.title(), request.body());
        return ApiResponse.of("Post created successfully", PostResponse.from(post));
    }

    @PutMapping("/{id}")
    public ApiResponse<PostResponse> update(
            CallerIdentity caller,
            @PathVariable UUID id,
            @Valid @RequestBody UpdatePostRequest request) {
        var post = posts.update(caller, id, request.toPatch());
        return ApiResponse.of("Post updated successfully", PostResponse.from(post));
    }

    @DeleteMapping("/{id}")
    public ApiResponse<Void> delete(CallerIdentity caller, @PathVariable UUID id) {
        posts.delete(caller, id);
        return ApiResponse.message("Post deleted successfully");
    }

    private static List<PostResponse> toResponses(List<AuthoredPost> page) {
        return page.stream().map(PostResponse::from).toList();
    }
}
