@NamedInterface("api")
package kr.jemi.zcassa.seal.api;

import org.springframework.modulith.NamedInterface;
