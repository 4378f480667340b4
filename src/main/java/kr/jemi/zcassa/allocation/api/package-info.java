@NamedInterface("api")
package kr.jemi.zcassa.allocation.api;

import org.springframework.modulith.NamedInterface;
