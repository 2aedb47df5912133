package com.quill.content.application;

import com.quill.content.domain.User;
import com.quill.security.IssuedToken;

/**
 * A user together with a freshly minted bearer token.
 */
public record AuthResult(User user, IssuedToken token) {}
