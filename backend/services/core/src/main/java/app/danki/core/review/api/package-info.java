@NamedInterface("api")
package app.danki.core.review.api;

import org.springframework.modulith.NamedInterface;
