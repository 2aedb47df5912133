/**
 * Domain layer: users, posts, store ports and the error vocabulary.
 *
 * <ul>
 *   <li>Domain MUST NOT depend on infrastructure, application or api packages
 *   <li>Stores report expected outcomes as values ({@link com.quill.content.domain.WriteResult},
 *       {@link java.util.Optional}); only the application layer turns them into exceptions
 * </ul>
 */
package com.quill.content.domain;
